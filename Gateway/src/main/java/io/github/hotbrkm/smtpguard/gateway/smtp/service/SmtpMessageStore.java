package io.github.hotbrkm.smtpguard.gateway.smtp.service;

import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Writes accepted messages to the inbox directory and quarantined ones to the quarantine directory.
 */
@Slf4j
@Component
public class SmtpMessageStore {

    private static final DateTimeFormatter FILE_NAME_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    private final GatewaySmtpProperties properties;
    private final Path inboxDirectory;
    private final Path quarantineDirectory;

    public SmtpMessageStore(GatewaySmtpProperties properties) {
        this.properties = properties;
        this.inboxDirectory = resolveDirectory(properties.getInboxDirectory(), "gateway.smtp.inbox-directory");
        this.quarantineDirectory = resolveDirectory(properties.getQuarantineDirectory(), "gateway.smtp.quarantine-directory");
    }

    @PostConstruct
    void prepareDirectories() {
        if (!properties.isStoreMessages()) {
            log.info("SMTP message storage is disabled.");
            return;
        }

        createDirectory(inboxDirectory, "inbox");
        createDirectory(quarantineDirectory, "quarantine");
    }

    public void store(String from, String recipient, InputStream data, boolean quarantined) throws IOException {
        if (!properties.isStoreMessages()) {
            data.transferTo(OutputStream.nullOutputStream());
            return;
        }

        Path directory = quarantined ? quarantineDirectory : inboxDirectory;
        Path messagePath = directory.resolve(generateFileName(recipient));
        try (OutputStream outputStream = Files.newOutputStream(messagePath, StandardOpenOption.CREATE_NEW)) {
            data.transferTo(outputStream);
        }

        if (quarantined) {
            log.info("SMTP mail quarantined - from: {}, to: {}, stored: {}", from, recipient, messagePath.toAbsolutePath());
        } else {
            log.info("SMTP mail received - from: {}, to: {}, stored: {}", from, recipient, messagePath.toAbsolutePath());
        }
    }

    private void createDirectory(Path directory, String kind) {
        try {
            Files.createDirectories(directory);
            log.info("SMTP {} directory initialized at {}", kind, directory.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create SMTP " + kind + " directory: " + directory, e);
        }
    }

    private Path resolveDirectory(String directory, String property) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalStateException("Property '" + property + "' is required.");
        }
        return Paths.get(directory);
    }

    private String generateFileName(String recipient) {
        String sanitizedRecipient = recipient == null ? "unknown" : recipient.replaceAll("[^a-zA-Z0-9@._-]", "_");
        String timestamp = FILE_NAME_FORMATTER.format(LocalDateTime.now());
        String unique = UUID.randomUUID().toString().substring(0, 8);
        return timestamp + "-" + sanitizedRecipient + "-" + unique + ".eml";
    }
}
