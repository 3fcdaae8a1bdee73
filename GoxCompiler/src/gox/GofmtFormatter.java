package gox;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;

/** Pipes source through an external {@code gofmt}. */
public class GofmtFormatter implements SourceFormatter {

  private static final long TIMEOUT_SECONDS = 30;

  private final ImmutableList<String> command;

  public GofmtFormatter() {
    this("gofmt");
  }

  public GofmtFormatter(String executable) {
    this(ImmutableList.of(executable));
  }

  GofmtFormatter(List<String> command) {
    this.command = ImmutableList.copyOf(command);
  }

  @Override
  public String format(String source) throws FormatterException {
    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException ex) {
      throw new FormatterException("cannot start " + command.get(0), ex);
    }

    // stderr is drained on its own thread so a chatty process cannot block on a full pipe.
    FutureTask<byte[]> stderr =
        new FutureTask<>(
            () -> {
              try (InputStream err = process.getErrorStream()) {
                return ByteStreams.toByteArray(err);
              }
            });
    Thread drain = new Thread(stderr, "gofmt-stderr");
    drain.setDaemon(true);
    drain.start();

    try {
      try (OutputStream stdin = process.getOutputStream()) {
        stdin.write(source.getBytes(StandardCharsets.UTF_8));
      }
      byte[] stdout;
      try (InputStream out = process.getInputStream()) {
        stdout = ByteStreams.toByteArray(out);
      }
      if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        throw new FormatterException(command.get(0) + " timed out");
      }
      if (process.exitValue() != 0) {
        throw new FormatterException(
            new String(stderr.get(TIMEOUT_SECONDS, TimeUnit.SECONDS), StandardCharsets.UTF_8)
                .trim());
      }
      return new String(stdout, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new FormatterException(command.get(0) + " failed", ex);
    } catch (ExecutionException ex) {
      throw new FormatterException(command.get(0) + " failed", ex.getCause());
    } catch (TimeoutException ex) {
      throw new FormatterException(command.get(0) + " timed out", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new FormatterException(command.get(0) + " interrupted", ex);
    } finally {
      process.destroy();
    }
  }
}
