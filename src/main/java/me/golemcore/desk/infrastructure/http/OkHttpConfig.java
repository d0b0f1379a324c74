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

package me.golemcore.desk.infrastructure.http;

import me.golemcore.desk.infrastructure.config.DeskProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Base {@link OkHttpClient} for outbound HTTP collaborators.
 *
 * <p>
 * Only the connect timeout is set here. The knowledge client derives its own
 * instance with {@link OkHttpClient#newBuilder()} and adds read and call
 * timeouts from {@code desk.knowledge.timeout-seconds}.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final DeskProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getHttp().getConnectTimeout(), TimeUnit.MILLISECONDS)
                .build();
    }
}
