package dpgen.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Selects one {@link CaseItem} by the value of a selector signal, or the default assignments if no item matches. */
public class CaseStatement extends ControlBlock {
  private final Signal selector;
  private final ArrayList<CaseItem> cases = new ArrayList<>();
  private final ArrayList<Assignment> defaults = new ArrayList<>();

  public CaseStatement(Signal selector) { this.selector = Objects.requireNonNull(selector); }

  public Signal getSelector() { return selector; }
  public List<CaseItem> getCases() { return Collections.unmodifiableList(cases); }
  public List<Assignment> getDefaults() { return Collections.unmodifiableList(defaults); }

  /**
   * Appends a new case item.
   * @param matchValue the selector value of the item; must not be used by another item of this statement
   * @return the new, empty item
   */
  public CaseItem addCase(int matchValue) {
    if (cases.stream().anyMatch(item -> item.getMatchValue() == matchValue))
      throw new IllegalArgumentException("Duplicate case value " + matchValue + " for selector " + selector.getName());
    CaseItem item = new CaseItem(matchValue);
    cases.add(item);
    return item;
  }

  public void addDefault(Signal target, Signal source) { defaults.add(new Assignment(target, source)); }

  @Override
  public List<List<Assignment>> regionAssignments() {
    List<List<Assignment>> ret = new ArrayList<>();
    cases.forEach(item -> ret.add(item.getAssignments()));
    if (!defaults.isEmpty())
      ret.add(getDefaults());
    return ret;
  }

  @Override
  public List<Operation> operations() {
    List<Operation> ret = new ArrayList<>();
    cases.forEach(item -> ret.addAll(item.getOperations()));
    return ret;
  }
}
