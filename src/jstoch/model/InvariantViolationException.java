package jstoch.model;

/**
 * Internal consistency failure: a quantity that must be conserved or bounded
 * is not. Results after the failing day cannot be trusted, so simulators
 * refuse to continue once one of these is thrown.
 */
@SuppressWarnings("serial")
public class InvariantViolationException extends SimulationException
{
	private final String invariant;
	private final String unit;
	
	public InvariantViolationException(String invariant, String unit, int day, String detail)
	{
		super(formatMessage(invariant, unit, day, detail), day);
		this.invariant = invariant;
		this.unit = unit;
	}
	
	private InvariantViolationException(InvariantViolationException undated, int day)
	{
		super(formatMessage(undated.invariant, undated.unit, day, null), day, undated);
		this.invariant = undated.invariant;
		this.unit = undated.unit;
	}
	
	/**
	 * Returns an exception carrying the given day, wrapping this one.
	 * Components that do not know the current day throw with day -1
	 * and let the caller date the failure.
	 */
	public InvariantViolationException atDay(int day)
	{
		if(getDay() == day) return this;
		return new InvariantViolationException(this, day);
	}
	
	public String getInvariant()
	{
		return invariant;
	}
	
	public String getUnit()
	{
		return unit;
	}
	
	private static String formatMessage(String invariant, String unit, int day, String detail)
	{
		String message = String.format("Invariant '%s' violated in %s on day %d", invariant, unit, day);
		if(detail != null)
			message += ": " + detail;
		return message;
	}
}
