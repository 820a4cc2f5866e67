package sejirs;

import jstoch.model.InvariantViolationException;

/**
 * Hospital and ICU beds of one province.
 * 
 * Admissions never exceed capacity; a refused admission is reported to the
 * caller, which applies the {@link AdmissionPolicy}. Releasing a bed that
 * is not occupied is an internal failure.
 */
public class ResourcePool
{
	private final String provinceId;
	private final int hospitalCapacity;
	private final int icuCapacity;
	
	private int hospitalOccupied;
	private int icuOccupied;
	
	public ResourcePool(String provinceId, int hospitalCapacity, int icuCapacity)
	{
		if(hospitalCapacity < 0 || icuCapacity < 0)
			throw new IllegalArgumentException("Capacities must be non-negative.");
		
		this.provinceId = provinceId;
		this.hospitalCapacity = hospitalCapacity;
		this.icuCapacity = icuCapacity;
	}
	
	/**
	 * Reserves one bed of the given class.
	 * 
	 * @return true if a bed was free and is now reserved
	 */
	public boolean admit(Severity severity)
	{
		return admit(severity, 1) == 1;
	}
	
	/**
	 * Reserves up to {@code requested} beds.
	 * 
	 * @return the number reserved; the rest were refused
	 */
	public int admit(Severity severity, int requested)
	{
		if(requested < 0) throw new IllegalArgumentException("Negative admission request: " + requested);
		
		int admitted = Math.min(requested, free(severity));
		if(severity == Severity.MODERATE)
			hospitalOccupied += admitted;
		else
			icuOccupied += admitted;
		return admitted;
	}
	
	public void release(Severity severity) throws InvariantViolationException
	{
		release(severity, 1);
	}
	
	public void release(Severity severity, int count) throws InvariantViolationException
	{
		if(count < 0) throw new IllegalArgumentException("Negative release: " + count);
		
		if(count > occupied(severity))
		{
			throw new InvariantViolationException(severity == Severity.MODERATE ? "hospital occupancy >= 0" : "icu occupancy >= 0",
				provinceId, -1,
				String.format("releasing %d beds with %d occupied", count, occupied(severity)));
		}
		
		if(severity == Severity.MODERATE)
			hospitalOccupied -= count;
		else
			icuOccupied -= count;
	}
	
	public int free(Severity severity)
	{
		return capacity(severity) - occupied(severity);
	}
	
	public int occupied(Severity severity)
	{
		return severity == Severity.MODERATE ? hospitalOccupied : icuOccupied;
	}
	
	public int capacity(Severity severity)
	{
		return severity == Severity.MODERATE ? hospitalCapacity : icuCapacity;
	}
	
	public int getHospitalOccupied()
	{
		return hospitalOccupied;
	}
	
	public int getIcuOccupied()
	{
		return icuOccupied;
	}
	
	public int getHospitalCapacity()
	{
		return hospitalCapacity;
	}
	
	public int getIcuCapacity()
	{
		return icuCapacity;
	}
}
