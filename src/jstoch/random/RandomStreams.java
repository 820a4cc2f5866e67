package jstoch.random;

import cern.jet.random.engine.MersenneTwister;
import cern.jet.random.engine.RandomEngine;

/**
 * Derives independent, reproducible random streams from one master seed.
 * 
 * A stream is identified by (day, unit, phase); the same identifiers always
 * give an engine producing the same sequence, regardless of which thread
 * asks for it or in what order streams are requested.
 */
public class RandomStreams
{
	private final long seed;
	
	public RandomStreams(long seed)
	{
		this.seed = seed;
	}
	
	public long getSeed()
	{
		return seed;
	}
	
	public RandomEngine stream(int day, int unit, int phase)
	{
		return new MersenneTwister(deriveSeed(day, unit, phase));
	}
	
	public int deriveSeed(int day, int unit, int phase)
	{
		long z = mix(seed);
		z = mix(z ^ day);
		z = mix(z ^ unit);
		z = mix(z ^ phase);
		return (int)(z ^ (z >>> 32));
	}
	
	// SplitMix64 finalizer
	private static long mix(long z)
	{
		z += 0x9E3779B97F4A7C15L;
		z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
		z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
		return z ^ (z >>> 31);
	}
}
