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

package me.golemcore.desk.port.outbound;

import me.golemcore.desk.domain.model.InboundMail;

import java.util.List;

/**
 * Port for pulling raw support mail from an external mailbox.
 */
public interface MailSourcePort {

    /**
     * Connector name stored as the message source (e.g. {@code imap},
     * {@code gmail}, {@code none}).
     */
    String getSourceName();

    /**
     * Fetch up to {@code limit} of the newest candidate messages.
     *
     * @throws MailSourceException
     *             if the mailbox cannot be reached or read
     */
    List<InboundMail> fetch(int limit);

    boolean isEnabled();

    /**
     * Raised when the external mailbox fails.
     */
    class MailSourceException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public MailSourceException(String message) {
            super(message);
        }

        public MailSourceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
