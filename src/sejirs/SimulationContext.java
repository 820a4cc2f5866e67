package sejirs;

import java.util.*;

import jstoch.random.RandomStreams;

/**
 * Mutable state of one run: the provinces, the mobility graph and the
 * random streams. Created at the start of a run and dropped with it.
 */
public class SimulationContext
{
	private final Parameters parameters;
	private final List<Province> provinces;
	private final MobilityNetwork network;
	private final RandomStreams streams;
	private final long initialPopulation;
	
	public SimulationContext(Parameters parameters)
	{
		this.parameters = parameters;
		
		List<Province> list = new ArrayList<Province>();
		long total = 0;
		for(Parameters.ProvinceParameters p : parameters.getProvinces())
		{
			Province province = new Province(p, parameters.getFractionPrudent(), parameters.getFractionVaccinated());
			list.add(province);
			total += province.getLiving();
		}
		provinces = Collections.unmodifiableList(list);
		initialPopulation = total;
		
		network = new MobilityNetwork(parameters);
		streams = new RandomStreams(parameters.getRandomSeed());
	}
	
	public Parameters getParameters()
	{
		return parameters;
	}
	
	public List<Province> getProvinces()
	{
		return provinces;
	}
	
	public MobilityNetwork getNetwork()
	{
		return network;
	}
	
	public RandomStreams getStreams()
	{
		return streams;
	}
	
	public long getInitialPopulation()
	{
		return initialPopulation;
	}
	
	public long getTotalActive()
	{
		long active = 0;
		for(Province province : provinces)
			active += province.getActive();
		return active;
	}
}
