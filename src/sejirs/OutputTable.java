package sejirs;

import java.util.*;

import com.google.gson.*;

/**
 * The finished time series of a run: one row per (day, province), days in
 * order and provinces in configuration order within a day.
 * 
 * The column names and their order are the contract with the writers
 * downstream; any change to them must bump {@link #SCHEMA_VERSION}.
 */
public final class OutputTable
{
	public static final int SCHEMA_VERSION = 1;
	
	public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
		"day", "province_id", "S", "E", "I", "J3", "J4", "R",
		"cumulative_deaths", "hospital_occupied", "icu_occupied"));
	
	private final List<OutputRow> rows;
	private final List<DailySummary> summaries;
	
	public OutputTable(List<OutputRow> rows, List<DailySummary> summaries)
	{
		this.rows = Collections.unmodifiableList(new ArrayList<OutputRow>(rows));
		this.summaries = Collections.unmodifiableList(new ArrayList<DailySummary>(summaries));
	}
	
	public List<OutputRow> getRows()
	{
		return rows;
	}
	
	public List<DailySummary> getSummaries()
	{
		return summaries;
	}
	
	public List<OutputRow> rowsFor(String provinceId)
	{
		List<OutputRow> result = new ArrayList<OutputRow>();
		for(OutputRow row : rows)
		{
			if(row.getProvinceId().equals(provinceId))
				result.add(row);
		}
		return result;
	}
	
	public List<OutputRow> rowsOn(int day)
	{
		List<OutputRow> result = new ArrayList<OutputRow>();
		for(OutputRow row : rows)
		{
			if(row.getDay() == day)
				result.add(row);
		}
		return result;
	}
	
	/**
	 * @return the last recorded day, or 0 for an empty table
	 */
	public int lastDay()
	{
		return rows.isEmpty() ? 0 : rows.get(rows.size() - 1).getDay();
	}
	
	/**
	 * Serializes the table as
	 * {"schemaVersion": 1, "columns": [...], "rows": [[...], ...]}.
	 * Equal tables give identical text.
	 */
	public String toJson()
	{
		JsonObject root = new JsonObject();
		root.addProperty("schemaVersion", SCHEMA_VERSION);
		
		JsonArray columns = new JsonArray();
		for(String column : COLUMNS)
			columns.add(column);
		root.add("columns", columns);
		
		JsonArray rowArray = new JsonArray();
		for(OutputRow row : rows)
		{
			JsonArray values = new JsonArray();
			for(Object value : row.values())
			{
				if(value instanceof Number)
					values.add((Number)value);
				else
					values.add(String.valueOf(value));
			}
			rowArray.add(values);
		}
		root.add("rows", rowArray);
		
		return new Gson().toJson(root);
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(!(obj instanceof OutputTable)) return false;
		return rows.equals(((OutputTable)obj).rows);
	}
	
	@Override
	public int hashCode()
	{
		return rows.hashCode();
	}
}
