package dpgen.netlist;

import java.util.Objects;

/**
 * Drives a module output from a pool signal.
 * Width differences are not corrected; they are recorded as an unchecked coercion so the renderer can make them visible.
 */
public final class OutputConnection {
  public enum Coercion {
    /** Source and output have the same width. */
    Exact,
    /** Source is wider than the output; the upper bits are dropped by the HDL assignment. */
    UncheckedTruncate,
    /** Source is narrower than the output; the HDL assignment extends it. */
    UncheckedExtend
  }

  private final Signal output;
  private final Signal source;
  private final Coercion coercion;

  private OutputConnection(Signal output, Signal source, Coercion coercion) {
    this.output = output;
    this.source = source;
    this.coercion = coercion;
  }

  public static OutputConnection connect(Signal output, Signal source) {
    Objects.requireNonNull(source);
    if (output.getRole() != SignalRole.Output)
      throw new IllegalArgumentException(output.getName() + " is not a module output");
    Coercion coercion = Coercion.Exact;
    if (source.getWidth() > output.getWidth())
      coercion = Coercion.UncheckedTruncate;
    else if (source.getWidth() < output.getWidth())
      coercion = Coercion.UncheckedExtend;
    return new OutputConnection(output, source, coercion);
  }

  public Signal getOutput() { return output; }
  public Signal getSource() { return source; }
  public Coercion getCoercion() { return coercion; }
}
