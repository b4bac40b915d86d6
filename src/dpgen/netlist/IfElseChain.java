package dpgen.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** An if / else if / else chain. At most one else branch, and only in last position. */
public class IfElseChain extends ControlBlock {
  private final ArrayList<Branch> branches = new ArrayList<>();

  public List<Branch> getBranches() { return Collections.unmodifiableList(branches); }

  public Branch addBranch(Signal condition) { return append(Optional.of(Objects.requireNonNull(condition))); }

  public Branch addElseBranch() { return append(Optional.empty()); }

  private Branch append(Optional<Signal> condition) {
    if (!branches.isEmpty() && branches.get(branches.size() - 1).isElse())
      throw new IllegalStateException("Cannot add a branch after the else branch");
    if (branches.isEmpty() && condition.isEmpty())
      throw new IllegalStateException("The first branch of a chain needs a condition");
    Branch branch = new Branch(condition);
    branches.add(branch);
    return branch;
  }

  @Override
  public List<List<Assignment>> regionAssignments() {
    List<List<Assignment>> ret = new ArrayList<>();
    branches.forEach(branch -> ret.add(branch.getAssignments()));
    return ret;
  }

  @Override
  public List<Operation> operations() {
    List<Operation> ret = new ArrayList<>();
    branches.forEach(branch -> ret.addAll(branch.getOperations()));
    return ret;
  }
}
