package jstoch.model;

/**
 * Thrown when a simulation cannot proceed. The day at which the failure
 * happened is kept when known; -1 means the failure is not tied to a day.
 */
@SuppressWarnings("serial")
public class SimulationException extends Exception
{
	private final int day;
	
	public SimulationException(String message)
	{
		this(message, -1, null);
	}

	public SimulationException(String message, Throwable cause)
	{
		this(message, -1, cause);
	}

	public SimulationException(String message, int day)
	{
		this(message, day, null);
	}

	public SimulationException(String message, int day, Throwable cause)
	{
		super(message, cause);
		this.day = day;
	}
	
	public int getDay()
	{
		return day;
	}
}
