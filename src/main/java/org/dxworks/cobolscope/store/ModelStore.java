package org.dxworks.cobolscope.store;

import org.dxworks.cobolscope.exception.CobolScopeException;
import org.dxworks.cobolscope.exception.ModelStoreException;
import org.dxworks.cobolscope.model.ProgramModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Persists one canonical JSON document per unit in a cache directory. A stored model is only
 * handed back when its content hash matches the hash of the freshly expanded source, so a
 * changed unit is always rebuilt.
 */
public class ModelStore {

    private static final Logger LOG = LoggerFactory.getLogger(ModelStore.class);

    private final Path directory;

    public ModelStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public Optional<ProgramModel> load(String unitId, String contentHash) {
        Path file = pathFor(unitId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        ProgramModel model;
        try {
            model = CanonicalJson.read(Files.readString(file, StandardCharsets.UTF_8), ProgramModel.class);
        } catch (IOException | CobolScopeException e) {
            throw new ModelStoreException("Cannot read stored model of " + unitId + " from " + file, e);
        }
        if (!unitId.equals(model.getUnitId()) || contentHash == null || !contentHash.equals(model.getContentHash())) {
            LOG.debug("Stored model of {} is stale", unitId);
            return Optional.empty();
        }
        return Optional.of(model);
    }

    public void save(ProgramModel model) {
        Path file = pathFor(model.getUnitId());
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, ".model", ".tmp");
            Files.writeString(temp, CanonicalJson.write(model), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ModelStoreException("Cannot store model of " + model.getUnitId() + " to " + file, e);
        }
    }

    public boolean delete(String unitId) {
        try {
            return Files.deleteIfExists(pathFor(unitId));
        } catch (IOException e) {
            throw new ModelStoreException("Cannot delete stored model of " + unitId, e);
        }
    }

    /**
     * File holding the model of {@code unitId}: a readable prefix of the id plus a digest, so that
     * ids differing only in punctuation do not collide.
     */
    Path pathFor(String unitId) {
        String readable = unitId.replaceAll("[^A-Za-z0-9._-]", "_");
        if (readable.length() > 80) {
            readable = readable.substring(readable.length() - 80);
        }
        return directory.resolve(readable + "-" + digest(unitId).substring(0, 12) + ".json");
    }

    private static String digest(String text) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
