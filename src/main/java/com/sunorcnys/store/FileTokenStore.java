package com.sunorcnys.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunorcnys.model.TokenRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token cache backed by one JSON file per service account.
 */
public class FileTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(FileTokenStore.class);

    private final String account;
    private final Path file;
    private final ObjectMapper mapper;
    private final ReentrantLock persistenceLock = new ReentrantLock();

    public FileTokenStore(Path file, ObjectMapper mapper) {
        this(null, file, mapper);
    }

    /**
     * @param account service account the file belongs to, reported on write failures
     */
    public FileTokenStore(String account, Path file, ObjectMapper mapper) {
        this.account = account;
        this.file = file;
        this.mapper = mapper;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Optional<TokenRecord> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            TokenRecord record = mapper.readValue(file.toFile(), TokenRecord.class);
            if (record.getAccessToken() == null || record.getAccessToken().isBlank()) {
                log.warn("Token cache {} has no access token, ignoring it", file);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (IOException e) {
            // a corrupt cache means re-authentication, not a crash
            log.warn("Failed to read token cache {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws TokenStoreException when the file cannot be written
     */
    @Override
    public void save(TokenRecord record) {
        persistenceLock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), record);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TokenStoreException(account, "Failed to persist token cache " + file, e);
        } finally {
            persistenceLock.unlock();
        }
    }

    @Override
    public void clear() {
        persistenceLock.lock();
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Token cache removed: {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to delete token cache {}: {}", file, e.getMessage());
        } finally {
            persistenceLock.unlock();
        }
    }
}
