package dpgen.netlist;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A group of mutually-exclusive regions (case items or if/else branches), at most one of which is active per evaluation.
 * All regions of a block write the same set of registers, so a synthesis tool may share the functional units that feed them.
 */
public abstract class ControlBlock {

  /**
   * The assignments of each exclusive region, in order.
   * For a case statement, the default region comes last if it has any assignments.
   */
  public abstract List<List<Assignment>> regionAssignments();

  /** All operations local to this block, in region order. */
  public abstract List<Operation> operations();

  /** The distinct registers written anywhere in the block, in order of first write. */
  public List<Signal> writtenSignals() {
    LinkedHashSet<Signal> written = new LinkedHashSet<>();
    regionAssignments().forEach(region -> region.forEach(assignment -> written.add(assignment.getTarget())));
    return new ArrayList<>(written);
  }

  /**
   * Checks that every region writes exactly the same registers.
   * @return true iff all regions agree on their written register set
   */
  public boolean writesSameSignalsInAllRegions() {
    List<LinkedHashSet<Signal>> sets = regionAssignments()
                                           .stream()
                                           .map(region -> region.stream().map(Assignment::getTarget).collect(Collectors.toCollection(LinkedHashSet::new)))
                                           .collect(Collectors.toList());
    return sets.stream().allMatch(set -> set.equals(sets.get(0)));
  }
}
