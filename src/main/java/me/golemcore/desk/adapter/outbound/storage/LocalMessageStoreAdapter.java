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

package me.golemcore.desk.adapter.outbound.storage;

import me.golemcore.desk.domain.model.SupportMessage;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.MessageStorePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link MessageStorePort}.
 *
 * <p>
 * One JSON file per message under {@code messages/} in the base directory.
 * All records are loaded into an in-memory index at startup; reads are served
 * from the index and every write goes through a temp file and an atomic move.
 * Callers always receive copies, so mutating a returned record never changes
 * the index.
 *
 * <p>
 * Base path configured via {@code desk.storage.base-path}, defaults to
 * {@code ${user.home}/.golemcore/desk}.
 *
 * @see MessageStorePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalMessageStoreAdapter implements MessageStorePort {

    private static final String MESSAGES_DIR = "messages";
    private static final String JSON_SUFFIX = ".json";

    private final DeskProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<Long, SupportMessage> index = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private Path messagesDir;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        Path basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.messagesDir = basePath.resolve(MESSAGES_DIR);

        try {
            Files.createDirectories(messagesDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create message directory: " + messagesDir, e);
        }

        long maxId = 0;
        try (Stream<Path> files = Files.list(messagesDir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX)).toList()) {
                try {
                    SupportMessage message = objectMapper.readValue(file.toFile(), SupportMessage.class);
                    index.put(message.getId(), message);
                    maxId = Math.max(maxId, message.getId());
                } catch (IOException e) {
                    log.warn("[Storage] Skipping unreadable message file {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list message directory: " + messagesDir, e);
        }
        nextId.set(maxId + 1);
        log.info("[Storage] Loaded {} messages from {}", index.size(), messagesDir);
    }

    @Override
    public synchronized SupportMessage create(SupportMessage message) {
        Instant now = clock.instant();
        SupportMessage record = message.toBuilder()
                .id(nextId.getAndIncrement())
                .createdAt(now)
                .updatedAt(now)
                .build();
        write(record);
        index.put(record.getId(), record);
        return copy(record);
    }

    @Override
    public synchronized SupportMessage save(SupportMessage message) {
        SupportMessage existing = index.get(message.getId());
        if (existing == null) {
            throw new IllegalArgumentException("Message not found: " + message.getId());
        }
        SupportMessage record = message.toBuilder()
                .createdAt(existing.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        write(record);
        index.put(record.getId(), record);
        return copy(record);
    }

    @Override
    public Optional<SupportMessage> findById(long id) {
        return Optional.ofNullable(index.get(id)).map(this::copy);
    }

    @Override
    public Optional<SupportMessage> findByExternalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        return index.values().stream()
                .filter(m -> externalId.equals(m.getExternalId()))
                .findFirst()
                .map(this::copy);
    }

    @Override
    public Optional<SupportMessage> findBySignature(String sender, String subject, String body,
            Instant receivedAt) {
        return index.values().stream()
                .filter(m -> Objects.equals(sender, m.getSender())
                        && Objects.equals(subject, m.getSubject())
                        && (receivedAt != null
                                ? receivedAt.equals(m.getReceivedAt())
                                : Objects.equals(body, m.getBody())))
                .findFirst()
                .map(this::copy);
    }

    @Override
    public List<SupportMessage> findAll() {
        return index.values().stream()
                .sorted(Comparator.comparing(SupportMessage::getReceivedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<SupportMessage> findWithoutResponse() {
        return index.values().stream()
                .filter(m -> !m.hasResponse())
                .sorted(Comparator.comparingLong(SupportMessage::getId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return index.size();
    }

    private void write(SupportMessage message) {
        Path target = messagesDir.resolve(message.getId() + JSON_SUFFIX);
        Path temp = messagesDir.resolve(message.getId() + JSON_SUFFIX + ".tmp");
        try {
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(message);
            try (OutputStream os = Files.newOutputStream(temp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
                    FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", temp);
            }
            throw new UncheckedIOException("Failed to write message " + message.getId(), e);
        }
    }

    private SupportMessage copy(SupportMessage message) {
        return message.toBuilder().build();
    }
}
