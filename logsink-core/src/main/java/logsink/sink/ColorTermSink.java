package logsink.sink;

import logsink.HandleContext;
import logsink.LogLevel;
import logsink.LogMessage;
import logsink.SinkKind;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Sink that prints each message to a terminal stream, colored by level with
 * ANSI escapes: yellow for {@link LogLevel#WARNING}, red for
 * {@link LogLevel#FATAL}, the terminal default otherwise.
 */
public final class ColorTermSink {
  static final String YELLOW = "\u001B[33m";
  static final String RED = "\u001B[31m";
  static final String RESET = "\u001B[0m";

  /** The color-term kind: any number of live instances. */
  public static final SinkKind<ColorTermSink, ColorTermSinkHandle> KIND = new SinkKind<>() {
    @Override
    public String name() {
      return "color-term";
    }

    @Override
    public void deliver(ColorTermSink sink, LogMessage message) {
      sink.receiveLogMessage(message);
    }

    @Override
    public ColorTermSinkHandle newHandle(HandleContext<ColorTermSink> context) {
      return new ColorTermSinkHandle(context);
    }

    @Override
    public void close(ColorTermSink sink) {
      sink.out.flush();
    }
  };

  private final PrintStream out;

  public ColorTermSink(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  public void receiveLogMessage(LogMessage message) {
    String color = colorOf(message.level());
    if (color.isEmpty()) {
      out.println(message.toText());
    } else {
      out.println(color + message.toText() + RESET);
    }
  }

  static String colorOf(LogLevel level) {
    return switch (level) {
      case WARNING -> YELLOW;
      case FATAL -> RED;
      default -> "";
    };
  }
}
