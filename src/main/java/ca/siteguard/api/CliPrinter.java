package ca.siteguard.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Console output for the SiteGuard commands. Reports go to stdout; diagnostics stay on the SLF4J stream.
 *
 * <p>Commands assemble a {@link Report} and print it in one write so a session summary is never interleaved with
 * another thread's output.</p>
 *
 * @since SiteGuard 0.1
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final String INDENT = "  ";
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    PrintWriter writer = writer();
    synchronized (writer) {
      writer.println(message);
    }
  }

  public static Report report() {
    return new Report();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }

  /** Line-oriented report: headline fields, then titled and counted sections. */
  public static final class Report {
    private final List<String> lines = new ArrayList<>();

    private Report() {}

    public Report line(String text) {
      lines.add(Objects.requireNonNull(text, "text"));
      return this;
    }

    /**
     * Adds an aligned {@code label : value} line.
     *
     * @param label field name, padded to a common width
     * @param value rendered with {@link String#valueOf(Object)}
     * @return this report
     */
    public Report field(String label, Object value) {
      lines.add(String.format(Locale.ROOT, " %-18s : %s", label, value));
      return this;
    }

    /**
     * Adds a {@code title (count):} header followed by one indented row per item.
     *
     * @param title section title
     * @param items section items, in display order
     * @param row renders one item
     * @param <T> item type
     * @return this report
     */
    public <T> Report section(String title, Collection<? extends T> items, Function<? super T, String> row) {
      lines.add(title + " (" + items.size() + "):");
      for (T item : items) {
        lines.add(INDENT + row.apply(item));
      }
      return this;
    }

    public void print() {
      PrintWriter writer = writer();
      synchronized (writer) {
        lines.forEach(writer::println);
        writer.flush();
      }
    }
  }
}
