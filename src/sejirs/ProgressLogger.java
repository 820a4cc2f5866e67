package sejirs;

import java.io.*;

import jstoch.logging.*;
import jstoch.model.*;

/**
 * Prints a tab-separated progress line every few days: day, new exposures,
 * prevalence, cumulative deaths and refused admissions.
 */
public class ProgressLogger implements PeriodicLogger
{
	private final EpidemicModel model;
	private final int interval;
	private final PrintStream stream;
	
	int logCount = 0;
	
	public ProgressLogger(EpidemicModel model, int interval)
	{
		this(model, interval, System.err);
	}
	
	public ProgressLogger(EpidemicModel model, int interval, PrintStream stream)
	{
		if(interval < 1)
			throw new IllegalArgumentException("Log interval must be at least 1");
		this.model = model;
		this.interval = interval;
		this.stream = stream;
	}
	
	public void logStart(DiscreteTimeModel ignore) throws LoggingException
	{
		logCount = 0;
		stream.printf("day\tnew_exposures\tprevalence\tdeaths\tdenied_hospital\tdenied_icu\n");
		stream.flush();
	}
	
	public void logEnd(DiscreteTimeModel ignore) throws LoggingException
	{
		DailySummary summary = model.getLastSummary();
		if(summary != null)
			stream.printf("ended on day %d with %d deaths\n", summary.getDay(), summary.getCumulativeDeaths());
		stream.flush();
	}
	
	public int getNextLogDay(DiscreteTimeModel ignore)
	{
		return (logCount + 1) * interval;
	}
	
	public void logPeriodic(DiscreteTimeModel ignore, int day) throws LoggingException
	{
		DailySummary summary = model.getLastSummary();
		if(summary == null)
			throw new LoggingException(this, "No summary for day " + day);
		
		stream.printf("%d\t%d\t%d\t%d\t%d\t%d\n",
			day,
			summary.getNewExposures(),
			summary.getPrevalence(),
			summary.getCumulativeDeaths(),
			summary.getDeniedHospital(),
			summary.getDeniedIcu());
		stream.flush();
		
		logCount++;
	}
}
