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
 * Named event delivered to live observers.
 *
 * @param name
 *            event name, e.g. {@code email_updated}
 * @param data
 *            JSON payload
 */
public record BroadcastEvent(String name, String data) {

    /**
     * Server-push framing: {@code event: <name>\ndata: <data>\n\n}.
     */
    public String toWireFormat() {
        return "event: " + name + "\ndata: " + data + "\n\n";
    }
}
