package sejirs;

import java.util.*;

/**
 * Whole-system figures for one day: new exposures, prevalence (active
 * infections), cumulative deaths and cumulative refused admissions.
 */
public final class DailySummary
{
	private final int day;
	private final int newExposures;
	private final long prevalence;
	private final long cumulativeDeaths;
	private final long deniedHospital;
	private final long deniedIcu;
	private final int vaccinated;
	private final int moved;
	
	public DailySummary(int day, int newExposures, long prevalence, long cumulativeDeaths,
		long deniedHospital, long deniedIcu, int vaccinated, int moved)
	{
		this.day = day;
		this.newExposures = newExposures;
		this.prevalence = prevalence;
		this.cumulativeDeaths = cumulativeDeaths;
		this.deniedHospital = deniedHospital;
		this.deniedIcu = deniedIcu;
		this.vaccinated = vaccinated;
		this.moved = moved;
	}
	
	static DailySummary of(int day, List<DayOutcome> outcomes, List<Province> provinces, int moved)
	{
		int newExposures = 0;
		int vaccinated = 0;
		for(DayOutcome outcome : outcomes)
		{
			newExposures += outcome.getNewExposures();
			vaccinated += outcome.getVaccinated();
		}
		
		long prevalence = 0;
		long deaths = 0;
		long deniedHospital = 0;
		long deniedIcu = 0;
		for(Province province : provinces)
		{
			prevalence += province.getActive();
			deaths += province.getCumulativeDeaths();
			deniedHospital += province.getDeniedAdmissions(Severity.MODERATE);
			deniedIcu += province.getDeniedAdmissions(Severity.SEVERE);
		}
		
		return new DailySummary(day, newExposures, prevalence, deaths, deniedHospital, deniedIcu, vaccinated, moved);
	}
	
	public int getDay() { return day; }
	public int getNewExposures() { return newExposures; }
	public long getPrevalence() { return prevalence; }
	public long getCumulativeDeaths() { return cumulativeDeaths; }
	public long getDeniedHospital() { return deniedHospital; }
	public long getDeniedIcu() { return deniedIcu; }
	public int getVaccinated() { return vaccinated; }
	public int getMoved() { return moved; }
}
