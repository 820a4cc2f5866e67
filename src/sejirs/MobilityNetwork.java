package sejirs;

import java.util.*;

import cern.jet.random.engine.RandomEngine;

import jstoch.random.BinomialSampler;
import jstoch.util.Apportionment;

/**
 * Directed, weighted graph of daily movement between provinces.
 * 
 * An edge weight is the daily probability that an individual of a movable
 * compartment travels along that edge. Departures are drawn once per
 * province and cell from the province's total outgoing weight and split over
 * the edges by largest remainder, so nobody is lost or duplicated. Movers
 * keep their behavior class and days in compartment.
 */
public class MobilityNetwork
{
	/** Random stream phase used for movement. */
	public static final int STREAM_PHASE = 2;
	
	private final List<List<Parameters.Edge>> outgoing;
	private final double[] outgoingWeight;
	private final EnumSet<Compartment> movable;
	
	public MobilityNetwork(Parameters params)
	{
		int n = params.getProvinces().size();
		outgoing = new ArrayList<List<Parameters.Edge>>(n);
		for(int i = 0; i < n; i++)
			outgoing.add(new ArrayList<Parameters.Edge>());
		
		outgoingWeight = new double[n];
		for(Parameters.Edge edge : params.getEdges())
		{
			outgoing.get(edge.getFrom()).add(edge);
			outgoingWeight[edge.getFrom()] += edge.getWeight();
		}
		
		movable = EnumSet.noneOf(Compartment.class);
		movable.addAll(params.getMovableCompartments());
	}
	
	public List<Parameters.Edge> outgoing(int province)
	{
		return Collections.unmodifiableList(outgoing.get(province));
	}
	
	public double getOutgoingWeight(int province)
	{
		return outgoingWeight[province];
	}
	
	public boolean isMovable(Compartment compartment)
	{
		return movable.contains(compartment);
	}
	
	/**
	 * Moves individuals between provinces for one day. Reads every province's
	 * current table and replaces it with the post-movement table once all
	 * departures have been drawn.
	 * 
	 * @param factor multiplier on all edge weights (movement restrictions)
	 * @return number of individuals moved
	 */
	public int apply(SimulationContext context, int day, double factor)
	{
		List<Province> provinces = context.getProvinces();
		CohortTable[] next = new CohortTable[provinces.size()];
		for(Province province : provinces)
			next[province.getIndex()] = province.getCohorts().copy();
		
		int moved = 0;
		for(Province province : provinces)
		{
			int from = province.getIndex();
			List<Parameters.Edge> edges = outgoing.get(from);
			double departureProbability = Math.min(1.0, factor * outgoingWeight[from]);
			if(edges.isEmpty() || departureProbability <= 0) continue;
			
			double[] weights = new double[edges.size()];
			for(int e = 0; e < weights.length; e++)
				weights[e] = edges.get(e).getWeight();
			
			RandomEngine rng = context.getStreams().stream(day, from, STREAM_PHASE);
			BinomialSampler binomial = new BinomialSampler(rng);
			CohortTable current = province.getCohorts();
			
			for(Compartment compartment : movable)
			{
				for(BehaviorClass behavior : BehaviorClass.values())
				{
					for(int days = 0; days <= CohortTable.MAX_TRACKED_DAYS; days++)
					{
						int n = current.get(compartment, behavior, days);
						if(n == 0) continue;
						
						int departing = binomial.nextInt(n, departureProbability);
						if(departing == 0) continue;
						
						int[] shares = Apportionment.largestRemainder(departing, weights);
						next[from].add(compartment, behavior, days, -departing);
						for(int e = 0; e < shares.length; e++)
							next[edges.get(e).getTo()].add(compartment, behavior, days, shares[e]);
						moved += departing;
					}
				}
			}
		}
		
		for(Province province : provinces)
			province.setCohorts(next[province.getIndex()]);
		
		return moved;
	}
}
