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

package me.golemcore.desk.adapter.outbound.mail;

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;

import java.util.Properties;

/**
 * Creates Jakarta Mail IMAP sessions with the requested security settings.
 *
 * <p>
 * Not a Spring bean, used directly by {@link ImapMailSourceAdapter}.
 */
public final class MailSessionFactory {

    private static final String MAIL_PREFIX = "mail.";
    private static final String TRUE_VALUE = "true";

    private MailSessionFactory() {
    }

    /**
     * @param connectTimeout
     *            connection timeout in milliseconds
     * @param readTimeout
     *            read timeout in milliseconds
     */
    public static Session createImapSession(String host, int port, String username, String password,
            MailSecurity security, int connectTimeout, int readTimeout) {

        Properties props = buildImapProperties(host, port, security, connectTimeout, readTimeout);
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    static Properties buildImapProperties(String host, int port, MailSecurity security, int connectTimeout,
            int readTimeout) {
        Properties props = new Properties();
        String protocol = security.storeProtocol();
        String prefix = MAIL_PREFIX + protocol + ".";

        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "connectiontimeout", String.valueOf(connectTimeout));
        props.put(prefix + "timeout", String.valueOf(readTimeout));

        if (security == MailSecurity.SSL) {
            props.put(MAIL_PREFIX + "imaps.ssl.enable", TRUE_VALUE);
        } else if (security == MailSecurity.STARTTLS) {
            props.put(MAIL_PREFIX + "imap.starttls.enable", TRUE_VALUE);
            props.put(MAIL_PREFIX + "imap.starttls.required", TRUE_VALUE);
        }
        return props;
    }
}
