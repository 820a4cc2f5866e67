package jstoch.random;

import cern.jet.random.Binomial;
import cern.jet.random.engine.RandomEngine;

/**
 * Binomial draws over a colt engine, extended to the degenerate cases colt
 * rejects (n = 0, p &lt;= 0, p &gt;= 1). Probabilities outside [0,1] are
 * clamped; NaN counts as 0.
 * 
 * Not thread-safe: one sampler per random stream.
 */
public class BinomialSampler
{
	private Binomial binomial;
	
	public BinomialSampler(RandomEngine rng)
	{
		binomial = new Binomial(1, 0.5, rng);
	}
	
	public int nextInt(int n, double p)
	{
		if(n < 0) throw new IllegalArgumentException("Number of trials must be non-negative: " + n);
		
		if(n == 0 || !(p > 0)) return 0;
		if(p >= 1) return n;
		return binomial.nextInt(n, p);
	}
	
	/**
	 * Mutually exclusive trials evaluated in the given order: each of
	 * {@code n} individuals tries the first outcome with probability
	 * {@code probabilities[0]}, failing that the second, and so on.
	 * 
	 * @return the number of individuals realizing each outcome; individuals
	 * realizing none are {@code n} minus the sum
	 */
	public int[] nextSequential(int n, double[] probabilities)
	{
		int[] counts = new int[probabilities.length];
		int remaining = n;
		for(int i = 0; i < probabilities.length && remaining > 0; i++)
		{
			counts[i] = nextInt(remaining, probabilities[i]);
			remaining -= counts[i];
		}
		return counts;
	}
}
