package io.ledgerbridge.dataAccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerbridge.LedgerBridgeException;
import io.ledgerbridge.config.LedgerBridgeConfig;
import io.ledgerbridge.models.Credential;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Persists the one active credential as a JSON record. Writes go to a sibling temp file which is
 * then moved over the record, so a reader never sees a half written file.
 */
@Repository
@Slf4j
public class CredentialFileDAO {
  private final Path credentialPath;
  private final ObjectMapper objectMapper;

  @Autowired
  public CredentialFileDAO(LedgerBridgeConfig config, ObjectMapper objectMapper) {
    this(Path.of(config.getTokenPath()), objectMapper);
  }

  CredentialFileDAO(Path credentialPath, ObjectMapper objectMapper) {
    this.credentialPath = credentialPath.toAbsolutePath();
    this.objectMapper = objectMapper;
  }

  public Optional<Credential> load() {
    if (!Files.exists(credentialPath)) {
      return Optional.empty();
    }
    try {
      var credential = objectMapper.readValue(credentialPath.toFile(), Credential.class);
      log.info("Loaded OAuth credential from {}", credentialPath);
      return Optional.of(credential);
    } catch (IOException e) {
      // an unreadable record is the same as no record: the user has to authorize again
      log.warn("Ignoring unreadable credential file {}: {}", credentialPath, e.getMessage());
      return Optional.empty();
    }
  }

  public Credential save(Credential credential) {
    try {
      var directory = credentialPath.getParent();
      Files.createDirectories(directory);
      var tempFile = Files.createTempFile(directory, ".credential", ".tmp");
      try {
        restrictToOwner(tempFile);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), credential);
        moveIntoPlace(tempFile);
      } finally {
        Files.deleteIfExists(tempFile);
      }
      log.info("Saved OAuth credential to {}", credentialPath);
      return credential;
    } catch (IOException e) {
      throw new LedgerBridgeException("Failed to save credential to " + credentialPath, e);
    }
  }

  public boolean delete() {
    try {
      return Files.deleteIfExists(credentialPath);
    } catch (IOException e) {
      throw new LedgerBridgeException("Failed to delete credential at " + credentialPath, e);
    }
  }

  private void moveIntoPlace(Path tempFile) throws IOException {
    try {
      Files.move(
          tempFile,
          credentialPath,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, replacing instead", credentialPath);
      Files.move(tempFile, credentialPath, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void restrictToOwner(Path file) throws IOException {
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
    }
  }
}
