package jstoch.util;

/**
 * Integer apportionment by the largest-remainder (Hamilton) method.
 * The parts always sum exactly to the total being divided.
 */
public class Apportionment
{
	private Apportionment()
	{
	}
	
	/**
	 * Divides {@code total} into parts proportional to {@code weights}.
	 * Each part gets the floor of its exact quota; the units left over go to
	 * the largest fractional remainders, ties to the lower index.
	 */
	public static int[] largestRemainder(int total, double[] weights)
	{
		if(total < 0) throw new IllegalArgumentException("Total must be non-negative: " + total);
		
		double weightSum = 0;
		for(double weight : weights)
		{
			if(!(weight >= 0)) throw new IllegalArgumentException("Weights must be non-negative: " + weight);
			weightSum += weight;
		}
		
		int[] parts = new int[weights.length];
		if(total == 0) return parts;
		if(weightSum == 0) throw new IllegalArgumentException("Cannot divide " + total + " with all-zero weights.");
		
		double[] remainders = new double[weights.length];
		int allocated = 0;
		for(int i = 0; i < weights.length; i++)
		{
			double quota = total * (weights[i] / weightSum);
			parts[i] = (int)Math.floor(quota);
			remainders[i] = quota - parts[i];
			allocated += parts[i];
		}
		
		// Rounding in the quotas can overshoot by a unit; take it back from the smallest remainders.
		while(allocated > total)
		{
			int i = argExtreme(remainders, parts, weights, false);
			parts[i]--;
			remainders[i] += 1;
			allocated--;
		}
		
		while(allocated < total)
		{
			int i = argExtreme(remainders, parts, weights, true);
			parts[i]++;
			remainders[i] = Double.NEGATIVE_INFINITY;
			allocated++;
		}
		
		return parts;
	}
	
	/**
	 * Like {@link #largestRemainder(int, double[])} but no part exceeds its
	 * room; whatever a full part cannot take is passed on to the parts that
	 * still have room, in index order.
	 */
	public static int[] bounded(int total, int[] room)
	{
		int roomSum = 0;
		double[] weights = new double[room.length];
		for(int i = 0; i < room.length; i++)
		{
			roomSum += room[i];
			weights[i] = room[i];
		}
		if(total > roomSum) throw new IllegalArgumentException("Cannot fit " + total + " into room for " + roomSum);
		
		int[] parts = largestRemainder(total, weights);
		int overflow = 0;
		for(int i = 0; i < parts.length; i++)
		{
			if(parts[i] > room[i])
			{
				overflow += parts[i] - room[i];
				parts[i] = room[i];
			}
		}
		for(int i = 0; i < parts.length && overflow > 0; i++)
		{
			int extra = Math.min(overflow, room[i] - parts[i]);
			parts[i] += extra;
			overflow -= extra;
		}
		return parts;
	}
	
	private static int argExtreme(double[] remainders, int[] parts, double[] weights, boolean largest)
	{
		int best = -1;
		for(int i = 0; i < remainders.length; i++)
		{
			if(largest && weights[i] == 0) continue;
			if(!largest && parts[i] == 0) continue;
			if(best == -1
				|| (largest && remainders[i] > remainders[best])
				|| (!largest && remainders[i] < remainders[best]))
			{
				best = i;
			}
		}
		return best;
	}
}
