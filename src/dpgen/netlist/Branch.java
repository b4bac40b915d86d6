package dpgen.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** One region of an {@link IfElseChain}. A branch without a condition is the final else. */
public class Branch {
  private final Optional<Signal> condition;
  private final ArrayList<Operation> operations = new ArrayList<>();
  private final ArrayList<Assignment> assignments = new ArrayList<>();

  Branch(Optional<Signal> condition) { this.condition = condition; }

  public Optional<Signal> getCondition() { return condition; }
  public boolean isElse() { return condition.isEmpty(); }
  public List<Operation> getOperations() { return Collections.unmodifiableList(operations); }
  public List<Assignment> getAssignments() { return Collections.unmodifiableList(assignments); }

  public void addOperation(Operation operation) { operations.add(operation); }
  public void addAssignment(Signal target, Signal source) { assignments.add(new Assignment(target, source)); }
}
