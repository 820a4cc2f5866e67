package sejirs;

import java.util.*;

import jstoch.model.*;

/**
 * A run stopped because an internal consistency check failed. Carries the
 * rows recorded before the failing day.
 */
@SuppressWarnings("serial")
public class RunAbortedException extends SimulationException
{
	private final List<OutputRow> lastValidRows;
	
	public RunAbortedException(InvariantViolationException cause, List<OutputRow> lastValidRows)
	{
		super("Run aborted: " + cause.getMessage(), cause.getDay(), cause);
		this.lastValidRows = Collections.unmodifiableList(new ArrayList<OutputRow>(lastValidRows));
	}
	
	public InvariantViolationException getViolation()
	{
		return (InvariantViolationException)getCause();
	}
	
	public List<OutputRow> getLastValidRows()
	{
		return lastValidRows;
	}
}
