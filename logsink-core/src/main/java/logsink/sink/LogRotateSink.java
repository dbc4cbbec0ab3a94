package logsink.sink;

import logsink.HandleContext;
import logsink.LogMessage;
import logsink.SinkKind;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.zip.GZIPOutputStream;

/**
 * Sink that appends messages to {@code <directory>/<name>.log} and rotates the
 * file once it grows past {@link #getMaxLogSize() maxLogSize} bytes.
 *
 * <p>A rotated file is gzipped to {@code <name>.<timestamp>.log.gz} next to the
 * active file; only the newest {@link #getMaxArchiveLogCount() maxArchiveLogCount}
 * archives are kept. The flush policy flushes every N writes; {@code 0} leaves
 * flushing to the underlying buffer.
 *
 * <p>A rotation whose archiving step fails is logged and skipped: the active
 * file is reopened and keeps growing until the next rotation succeeds. If even
 * reopening fails, the next write tries to open the file again.
 *
 * <p>Not thread-safe on its own: the registry lock serializes every access.
 */
public final class LogRotateSink implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LogRotateSink.class.getName());

  public static final long DEFAULT_MAX_LOG_SIZE = 10L * 1024 * 1024;
  public static final int DEFAULT_MAX_ARCHIVE_LOG_COUNT = 10;

  private static final String LOG_SUFFIX = ".log";
  private static final String ARCHIVE_SUFFIX = ".log.gz";
  private static final DateTimeFormatter ARCHIVE_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

  /** The log-rotate kind: any number of live instances. */
  public static final SinkKind<LogRotateSink, LogRotateSinkHandle> KIND = new SinkKind<>() {
    @Override
    public String name() {
      return "log-rotate";
    }

    @Override
    public void deliver(LogRotateSink sink, LogMessage message) {
      sink.save(message.toText());
    }

    @Override
    public LogRotateSinkHandle newHandle(HandleContext<LogRotateSink> context) {
      return new LogRotateSinkHandle(context);
    }

    @Override
    public void close(LogRotateSink sink) throws IOException {
      sink.close();
    }
  };

  private Path directory;
  private String baseName;
  private BufferedWriter writer;
  private long currentSize;
  private long maxLogSize = DEFAULT_MAX_LOG_SIZE;
  private int maxArchiveLogCount = DEFAULT_MAX_ARCHIVE_LOG_COUNT;
  private int flushPolicy;
  private int writesSinceFlush;

  /**
   * Opens (or creates) {@code <directory>/<baseName>.log} for appending.
   *
   * @param directory the log directory; created if missing
   * @param baseName the file name without extension
   * @throws UncheckedIOException if the file cannot be opened
   */
  public LogRotateSink(Path directory, String baseName) {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(baseName, "baseName");
    if (baseName.isEmpty()) {
      throw new IllegalArgumentException("baseName must not be empty");
    }
    try {
      open(directory, baseName);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot open log file in " + directory, e);
    }
  }

  private void open(Path dir, String name) throws IOException {
    Files.createDirectories(dir);
    Path file = dir.resolve(name + LOG_SUFFIX);
    BufferedWriter opened = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    this.writer = opened;
    this.directory = dir;
    this.baseName = name;
    this.currentSize = Files.size(file);
    this.writesSinceFlush = 0;
  }

  /**
   * Appends one entry and a line separator, rotating first if the entry would
   * push the file past the size limit.
   *
   * @param entry the text to append
   * @throws UncheckedIOException if writing or rotating fails
   */
  public void save(String entry) {
    String line = entry + System.lineSeparator();
    long bytes = line.getBytes(StandardCharsets.UTF_8).length;
    try {
      if (writer == null) {
        open(directory, baseName);
      }
      if (currentSize > 0 && currentSize + bytes > maxLogSize) {
        rotate();
      }
      writer.write(line);
      currentSize += bytes;
      if (flushPolicy > 0 && ++writesSinceFlush >= flushPolicy) {
        writer.flush();
        writesSinceFlush = 0;
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write to " + logFileName(), e);
    }
  }

  /**
   * Switches to {@code <logDirectory>/<newName>.log}. The current file is
   * closed only once the new one is open.
   *
   * @param logDirectory the new directory
   * @param newName the new base name; empty keeps the current one
   * @return the new file path, or an empty string if it could not be opened
   *     (the current file stays active)
   */
  public String changeLogFile(Path logDirectory, String newName) {
    Objects.requireNonNull(logDirectory, "logDirectory");
    Objects.requireNonNull(newName, "newName");
    String name = newName.isEmpty() ? baseName : newName;
    BufferedWriter previous = writer;
    Path previousDir = directory;
    String previousName = baseName;
    long previousSize = currentSize;
    try {
      open(logDirectory, name);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot switch log file to " + logDirectory.resolve(name + LOG_SUFFIX), e);
      this.writer = previous;
      this.directory = previousDir;
      this.baseName = previousName;
      this.currentSize = previousSize;
      return "";
    }
    try {
      if (previous != null) {
        previous.close();
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot close previous log file "
          + previousDir.resolve(previousName + LOG_SUFFIX), e);
    }
    return logFileName();
  }

  public String logFileName() {
    return directory.resolve(baseName + LOG_SUFFIX).toString();
  }

  public void setMaxArchiveLogCount(int maxArchiveLogCount) {
    if (maxArchiveLogCount < 0) {
      throw new IllegalArgumentException("maxArchiveLogCount must be >= 0");
    }
    this.maxArchiveLogCount = maxArchiveLogCount;
  }

  public int getMaxArchiveLogCount() {
    return maxArchiveLogCount;
  }

  /**
   * Sets how often the file is flushed.
   *
   * @param flushPolicy {@code 0} to never force a flush, otherwise flush every
   *     {@code flushPolicy} writes
   */
  public void setFlushPolicy(int flushPolicy) {
    if (flushPolicy < 0) {
      throw new IllegalArgumentException("flushPolicy must be >= 0");
    }
    this.flushPolicy = flushPolicy;
    this.writesSinceFlush = 0;
  }

  public int getFlushPolicy() {
    return flushPolicy;
  }

  public void flush() {
    if (writer == null) {
      return;
    }
    try {
      writer.flush();
      writesSinceFlush = 0;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot flush " + logFileName(), e);
    }
  }

  public void setMaxLogSize(long maxLogSize) {
    if (maxLogSize <= 0) {
      throw new IllegalArgumentException("maxLogSize must be > 0");
    }
    this.maxLogSize = maxLogSize;
  }

  public long getMaxLogSize() {
    return maxLogSize;
  }

  /**
   * Returns the archives of the current base name, oldest first.
   *
   * @return archive paths
   * @throws UncheckedIOException if the directory cannot be listed
   */
  public List<Path> archives() {
    Pattern own = Pattern.compile(Pattern.quote(baseName) + "\\.\\d{8}-\\d{6}-\\d{3}-\\d{3,}" + Pattern.quote(ARCHIVE_SUFFIX));
    List<Path> found = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory,
        path -> own.matcher(path.getFileName().toString()).matches())) {
      for (Path path : stream) {
        found.add(path);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list archives in " + directory, e);
    }
    // the UTC stamp sorts lexicographically
    Collections.sort(found);
    return found;
  }

  private void rotate() throws IOException {
    BufferedWriter current = writer;
    writer = null;
    current.close();
    boolean archived = archiveActive();
    open(directory, baseName);
    if (archived) {
      pruneArchives();
    }
  }

  private boolean archiveActive() {
    Path active = directory.resolve(baseName + LOG_SUFFIX);
    Path archive = null;
    try {
      archive = archivePath();
      try (InputStream in = Files.newInputStream(active);
           OutputStream out = new GZIPOutputStream(Files.newOutputStream(archive))) {
        in.transferTo(out);
      }
      Files.delete(active);
      return true;
    } catch (IOException | UncheckedIOException e) {
      logger.log(Level.WARNING, "Cannot archive " + active + "; continuing in the same file", e);
      if (archive != null) {
        discard(archive);
      }
      return false;
    }
  }

  private static void discard(Path partialArchive) {
    try {
      Files.deleteIfExists(partialArchive);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot delete partial archive " + partialArchive, e);
    }
  }

  private Path archivePath() {
    String prefix = baseName + "." + ARCHIVE_STAMP.format(Instant.now()) + "-";
    // archives rotated within the same millisecond keep counting up so they stay ordered
    int sequence = 0;
    for (Path existing : archives()) {
      String name = existing.getFileName().toString();
      if (name.startsWith(prefix)) {
        String digits = name.substring(prefix.length(), name.length() - ARCHIVE_SUFFIX.length());
        sequence = Math.max(sequence, Integer.parseInt(digits) + 1);
      }
    }
    return directory.resolve(String.format("%s%03d%s", prefix, sequence, ARCHIVE_SUFFIX));
  }

  private void pruneArchives() throws IOException {
    List<Path> all = archives();
    for (int i = 0; i < all.size() - maxArchiveLogCount; i++) {
      Files.deleteIfExists(all.get(i));
    }
  }

  @Override
  public void close() throws IOException {
    if (writer != null) {
      writer.close();
    }
  }
}
