package jstoch.logging;

import jstoch.model.*;

/**
 * Observer notified by a simulator at the end of a day. The simulator calls
 * {@link #logPeriodic(DiscreteTimeModel, int)} once the current day has
 * reached {@link #getNextLogDay(DiscreteTimeModel)}.
 */
public interface PeriodicLogger
{
	public void logStart(DiscreteTimeModel model) throws LoggingException;
	public void logEnd(DiscreteTimeModel model) throws LoggingException;
	
	public int getNextLogDay(DiscreteTimeModel model);
	public void logPeriodic(DiscreteTimeModel model, int day) throws LoggingException;
}
