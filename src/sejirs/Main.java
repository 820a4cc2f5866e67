package sejirs;

import java.io.*;
import java.util.Date;


public class Main
{
	public static void main(String[] args) throws Throwable
	{
		if(args.length < 1)
		{
			System.err.println("Usage: sejirs.Main <config.json>");
			System.exit(1);
		}
		
		Config config;
		Reader r = new FileReader(args[0]);
		try
		{
			config = Config.load(r);
		}
		finally
		{
			r.close();
		}
		
		// Fix the seed so that the run can be repeated from parameters_out
		if(config.randomSeed == null)
			config.randomSeed = (int)(new Date()).getTime();
		
		Parameters params;
		try
		{
			params = Parameters.fromConfig(config);
		}
		catch(ConfigurationException e)
		{
			System.err.println("Invalid configuration:");
			for(String problem : e.getProblems())
				System.err.println("  " + problem);
			System.exit(2);
			return;
		}
		
		// Write parameters file as read
		PrintStream paramsStream = new PrintStream(outputFilename("parameters_out", config.runNum), "UTF-8");
		paramsStream.println(config.toJson());
		paramsStream.close();
		
		EpidemicSimulation simulation = new EpidemicSimulation(params);
		simulation.addLogger(new ProgressLogger(simulation.getModel(), config.logInterval));
		
		System.err.println("Start date: " + new Date());
		OutputTable table;
		try
		{
			table = simulation.run();
		}
		catch(RunAbortedException e)
		{
			System.err.println(e.getMessage());
			table = new OutputTable(e.getLastValidRows(), simulation.getRecorder().getSummaries());
			writeTable(table, outputFilename("output", config.runNum));
			throw e;
		}
		writeTable(table, outputFilename("output", config.runNum));
		System.err.println("End date: " + new Date());
	}
	
	static String outputFilename(String base, Integer runNum)
	{
		if(runNum == null)
			return base + ".json";
		return String.format("%s.%d.json", base, runNum);
	}
	
	private static void writeTable(OutputTable table, String filename) throws IOException
	{
		PrintStream stream = new PrintStream(filename, "UTF-8");
		stream.println(table.toJson());
		stream.close();
	}
}
