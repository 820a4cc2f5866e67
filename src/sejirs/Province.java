package sejirs;

import jstoch.util.Apportionment;

/**
 * A province membrane: owns its cohorts, its beds and its death toll.
 * 
 * A province is only changed by its own rule evaluation and by the mobility
 * step, never by another province's rules.
 */
public class Province
{
	private final String id;
	private final int index;
	private final ResourcePool resources;
	
	private CohortTable cohorts;
	
	private int cumulativeDeaths;
	private int deniedHospital;
	private int deniedIcu;
	
	public Province(Parameters.ProvinceParameters params, double fractionPrudent, double fractionVaccinated)
	{
		id = params.getId();
		index = params.getIndex();
		resources = new ResourcePool(id, params.getHospitalCapacity(), params.getIcuCapacity());
		cohorts = seed(params, fractionPrudent, fractionVaccinated);
	}
	
	/**
	 * Splits the population over behavior classes, then places the initial
	 * exposed and infectious individuals in proportion to class sizes.
	 * Everyone starts at day 0 of their compartment.
	 */
	private static CohortTable seed(Parameters.ProvinceParameters params, double fractionPrudent, double fractionVaccinated)
	{
		BehaviorClass[] classes = BehaviorClass.values();
		double[] shares = new double[classes.length];
		for(int i = 0; i < classes.length; i++)
			shares[i] = classes[i].share(fractionPrudent, fractionVaccinated);
		
		int[] sizes = Apportionment.largestRemainder(params.getPopulation(), shares);
		int[] exposed = Apportionment.bounded(params.getInitialExposed(), sizes);
		
		int[] room = new int[classes.length];
		for(int i = 0; i < classes.length; i++)
			room[i] = sizes[i] - exposed[i];
		int[] infectious = Apportionment.bounded(params.getInitialInfectious(), room);
		
		CohortTable table = new CohortTable();
		for(int i = 0; i < classes.length; i++)
		{
			table.add(Compartment.S, classes[i], 0, room[i] - infectious[i]);
			table.add(Compartment.E, classes[i], 0, exposed[i]);
			table.add(Compartment.I, classes[i], 0, infectious[i]);
		}
		return table;
	}
	
	public String getId()
	{
		return id;
	}
	
	public int getIndex()
	{
		return index;
	}
	
	public ResourcePool getResources()
	{
		return resources;
	}
	
	public CohortTable getCohorts()
	{
		return cohorts;
	}
	
	void setCohorts(CohortTable cohorts)
	{
		this.cohorts = cohorts;
	}
	
	public int count(Compartment compartment)
	{
		if(compartment == Compartment.DECEASED)
			return cumulativeDeaths;
		return cohorts.count(compartment);
	}
	
	public int getLiving()
	{
		return cohorts.living();
	}
	
	public int getActive()
	{
		return cohorts.active();
	}
	
	public int getCumulativeDeaths()
	{
		return cumulativeDeaths;
	}
	
	void addDeaths(int deaths)
	{
		cumulativeDeaths += deaths;
	}
	
	public int getDeniedAdmissions(Severity severity)
	{
		return severity == Severity.MODERATE ? deniedHospital : deniedIcu;
	}
	
	void addDeniedAdmissions(Severity severity, int count)
	{
		if(severity == Severity.MODERATE)
			deniedHospital += count;
		else
			deniedIcu += count;
	}
	
	@Override
	public String toString()
	{
		return String.format("Province(%s, living=%d, active=%d, deaths=%d)", id, getLiving(), getActive(), cumulativeDeaths);
	}
}
