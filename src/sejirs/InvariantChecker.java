package sejirs;

import java.util.*;

import jstoch.model.InvariantViolationException;

/**
 * End-of-day consistency checks. Any failure means the run can no longer be
 * trusted and must stop.
 */
public class InvariantChecker
{
	private final long initialPopulation;
	private final Map<String, Integer> lastDeaths = new HashMap<String, Integer>();
	
	public InvariantChecker(long initialPopulation)
	{
		this.initialPopulation = initialPopulation;
	}
	
	public void check(List<Province> provinces, int day) throws InvariantViolationException
	{
		long total = 0;
		for(Province province : provinces)
		{
			checkProvince(province, day);
			total += province.getLiving() + province.getCumulativeDeaths();
		}
		
		if(total != initialPopulation)
		{
			throw new InvariantViolationException("population conservation", "all provinces", day,
				String.format("living plus deceased is %d, initial population was %d", total, initialPopulation));
		}
	}
	
	private void checkProvince(Province province, int day) throws InvariantViolationException
	{
		String id = province.getId();
		CohortTable cohorts = province.getCohorts();
		ResourcePool pool = province.getResources();
		
		if(cohorts.minimum() < 0)
			throw new InvariantViolationException("non-negative counts", id, day, "a cohort count is " + cohorts.minimum());
		
		for(Severity severity : Severity.values())
		{
			int occupied = pool.occupied(severity);
			int capacity = pool.capacity(severity);
			String name = severity == Severity.MODERATE ? "hospital" : "icu";
			
			if(occupied < 0 || occupied > capacity)
			{
				throw new InvariantViolationException(name + " occupancy within capacity", id, day,
					String.format("%d occupied of %d", occupied, capacity));
			}
			
			int patients = cohorts.count(severity.compartment());
			if(occupied != patients)
			{
				throw new InvariantViolationException(name + " occupancy matches " + severity.compartment(), id, day,
					String.format("%d beds occupied for %d patients", occupied, patients));
			}
		}
		
		Integer previous = lastDeaths.get(id);
		if(previous != null && province.getCumulativeDeaths() < previous)
		{
			throw new InvariantViolationException("monotonic deaths", id, day,
				String.format("cumulative deaths fell from %d to %d", previous, province.getCumulativeDeaths()));
		}
		lastDeaths.put(id, province.getCumulativeDeaths());
	}
}
