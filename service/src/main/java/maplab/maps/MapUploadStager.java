package maplab.maps;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Copies uploaded map files to temporary files so they can be parsed like local files. Callers
 * own the staged file and hand it back to {@link #discard(Path)} once done.
 */
@Component
public class MapUploadStager {
  private static final Logger log = LoggerFactory.getLogger(MapUploadStager.class);
  private static final Pattern SAFE_EXTENSION = Pattern.compile("[A-Za-z0-9]{1,10}");
  private static final String DEFAULT_SUFFIX = ".csv";

  public Path stage(MultipartFile upload) {
    Path staged = null;
    try {
      staged = Files.createTempFile("maplab-upload-", suffixOf(upload.getOriginalFilename()));
      try (InputStream in = upload.getInputStream()) {
        Files.copy(in, staged, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Staged upload {} ({} bytes) at {}", upload.getOriginalFilename(),
          upload.getSize(), staged);
      return staged;
    } catch (IOException ex) {
      discard(staged);
      throw new UncheckedIOException("Unable to stage uploaded file", ex);
    }
  }

  public void discard(Path staged) {
    if (staged == null) {
      return;
    }
    try {
      Files.deleteIfExists(staged);
    } catch (IOException ex) {
      log.warn("Unable to delete staged upload {}: {}", staged, ex.getMessage(), ex);
    }
  }

  static String suffixOf(String filename) {
    String extension = StringUtils.getFilenameExtension(filename);
    if (extension == null || !SAFE_EXTENSION.matcher(extension).matches()) {
      return DEFAULT_SUFFIX;
    }
    return "." + extension;
  }
}
