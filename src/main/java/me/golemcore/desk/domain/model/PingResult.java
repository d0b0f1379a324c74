/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.desk.domain.model;

/**
 * Outcome of a one-off provider ping.
 *
 * @param ok
 *            whether the provider answered
 * @param provider
 *            provider id
 * @param model
 *            model name
 * @param text
 *            first characters of the answer, empty on failure
 * @param error
 *            failure reason, {@code null} on success
 */
public record PingResult(boolean ok, String provider, String model, String text, String error) {

    public static PingResult success(String provider, String model, String text) {
        return new PingResult(true, provider, model, text, null);
    }

    public static PingResult failure(String provider, String model, String error) {
        return new PingResult(false, provider, model, "", error);
    }
}
