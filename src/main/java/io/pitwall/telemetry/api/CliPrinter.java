package io.pitwall.telemetry.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes command output (JSON documents, dry-run plans, usage) to stdout. Diagnostics go through SLF4J.
 *
 * @since PITWALL 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a heading followed by one aligned {@code label : value} row per entry.
   *
   * @param heading first line
   * @param rows ordered rows; {@code null} values print as {@code <none>}
   */
  public static void printPlan(String heading, Map<String, String> rows) {
    PrintWriter writer = writer();
    writer.println(heading);
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    for (Map.Entry<String, String> row : rows.entrySet()) {
      String value = row.getValue() == null ? "<none>" : row.getValue();
      writer.println(" " + padRight(row.getKey(), width) + " : " + value);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static String padRight(String text, int width) {
    StringBuilder sb = new StringBuilder(width).append(text);
    while (sb.length() < width) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
