package dpgen.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One labelled region of a {@link CaseStatement}. */
public class CaseItem {
  private final int matchValue;
  private final ArrayList<Operation> operations = new ArrayList<>();
  private final ArrayList<Assignment> assignments = new ArrayList<>();

  CaseItem(int matchValue) { this.matchValue = matchValue; }

  public int getMatchValue() { return matchValue; }
  public List<Operation> getOperations() { return Collections.unmodifiableList(operations); }
  public List<Assignment> getAssignments() { return Collections.unmodifiableList(assignments); }

  public void addOperation(Operation operation) { operations.add(operation); }
  public void addAssignment(Signal target, Signal source) { assignments.add(new Assignment(target, source)); }
}
