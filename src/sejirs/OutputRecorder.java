package sejirs;

import java.util.*;

import jstoch.logging.*;
import jstoch.model.*;

/**
 * Collects one row per province after every simulated day, plus the daily
 * summary. The table is only available once the run has ended.
 */
public class OutputRecorder implements PeriodicLogger
{
	private final EpidemicModel model;
	
	private final List<OutputRow> rows = new ArrayList<OutputRow>();
	private final List<DailySummary> summaries = new ArrayList<DailySummary>();
	private List<OutputRow> lastDayRows = Collections.emptyList();
	
	private int logCount = 0;
	private boolean ended = false;
	
	public OutputRecorder(EpidemicModel model)
	{
		this.model = model;
	}
	
	public void logStart(DiscreteTimeModel ignore) throws LoggingException
	{
		rows.clear();
		summaries.clear();
		lastDayRows = Collections.emptyList();
		logCount = 0;
		ended = false;
	}
	
	public void logEnd(DiscreteTimeModel ignore) throws LoggingException
	{
		ended = true;
	}
	
	public int getNextLogDay(DiscreteTimeModel ignore)
	{
		return logCount + 1;
	}
	
	public void logPeriodic(DiscreteTimeModel ignore, int day) throws LoggingException
	{
		if(day != logCount + 1)
			throw new LoggingException(this, String.format("Expected day %d, got day %d", logCount + 1, day));
		
		lastDayRows = Collections.unmodifiableList(model.snapshot(day));
		rows.addAll(lastDayRows);
		if(model.getLastSummary() != null)
			summaries.add(model.getLastSummary());
		
		logCount++;
	}
	
	/**
	 * Rows of the most recently recorded day.
	 */
	public List<OutputRow> getLastDayRows()
	{
		return lastDayRows;
	}
	
	/**
	 * Everything recorded so far, including the rows of a run that was cut
	 * short.
	 */
	public List<OutputRow> getRecordedRows()
	{
		return Collections.unmodifiableList(rows);
	}
	
	public List<DailySummary> getSummaries()
	{
		return Collections.unmodifiableList(summaries);
	}
	
	public int getDaysRecorded()
	{
		return logCount;
	}
	
	public boolean hasEnded()
	{
		return ended;
	}
	
	/**
	 * @throws IllegalStateException if the run has not ended yet
	 */
	public OutputTable toTable()
	{
		if(!ended)
			throw new IllegalStateException("Run has not ended");
		return new OutputTable(rows, summaries);
	}
}
