package sejirs;

import java.util.*;

/**
 * One day of one province, in the column order of {@link OutputTable#COLUMNS}.
 */
public final class OutputRow
{
	private final int day;
	private final String provinceId;
	private final int s;
	private final int e;
	private final int i;
	private final int j3;
	private final int j4;
	private final int r;
	private final int cumulativeDeaths;
	private final int hospitalOccupied;
	private final int icuOccupied;
	
	public OutputRow(int day, String provinceId, int s, int e, int i, int j3, int j4, int r,
		int cumulativeDeaths, int hospitalOccupied, int icuOccupied)
	{
		this.day = day;
		this.provinceId = provinceId;
		this.s = s;
		this.e = e;
		this.i = i;
		this.j3 = j3;
		this.j4 = j4;
		this.r = r;
		this.cumulativeDeaths = cumulativeDeaths;
		this.hospitalOccupied = hospitalOccupied;
		this.icuOccupied = icuOccupied;
	}
	
	static OutputRow of(int day, Province province)
	{
		ResourcePool pool = province.getResources();
		return new OutputRow(day, province.getId(),
			province.count(Compartment.S),
			province.count(Compartment.E),
			province.count(Compartment.I),
			province.count(Compartment.J3),
			province.count(Compartment.J4),
			province.count(Compartment.R),
			province.getCumulativeDeaths(),
			pool.getHospitalOccupied(),
			pool.getIcuOccupied());
	}
	
	public int getDay() { return day; }
	public String getProvinceId() { return provinceId; }
	public int getS() { return s; }
	public int getE() { return e; }
	public int getI() { return i; }
	public int getJ3() { return j3; }
	public int getJ4() { return j4; }
	public int getR() { return r; }
	public int getCumulativeDeaths() { return cumulativeDeaths; }
	public int getHospitalOccupied() { return hospitalOccupied; }
	public int getIcuOccupied() { return icuOccupied; }
	
	public int get(Compartment compartment)
	{
		switch(compartment)
		{
			case S: return s;
			case E: return e;
			case I: return i;
			case J3: return j3;
			case J4: return j4;
			case R: return r;
			default: return cumulativeDeaths;
		}
	}
	
	/**
	 * Living individuals in the province.
	 */
	public int getLiving()
	{
		return s + e + i + j3 + j4 + r;
	}
	
	public int getActive()
	{
		return e + i + j3 + j4;
	}
	
	/**
	 * Values in column order.
	 */
	public List<Object> values()
	{
		return Arrays.<Object>asList(day, provinceId, s, e, i, j3, j4, r, cumulativeDeaths, hospitalOccupied, icuOccupied);
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(!(obj instanceof OutputRow)) return false;
		return values().equals(((OutputRow)obj).values());
	}
	
	@Override
	public int hashCode()
	{
		return values().hashCode();
	}
	
	@Override
	public String toString()
	{
		return "OutputRow" + values();
	}
}
