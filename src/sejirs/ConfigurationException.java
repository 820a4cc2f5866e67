package sejirs;

import java.util.*;

/**
 * A configuration failed validation. All problems found are reported at once.
 */
public class ConfigurationException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;
	
	private final List<String> problems;
	
	public ConfigurationException(List<String> problems)
	{
		super("Invalid configuration: " + String.join("; ", problems));
		this.problems = Collections.unmodifiableList(new ArrayList<String>(problems));
	}
	
	public List<String> getProblems()
	{
		return problems;
	}
}
