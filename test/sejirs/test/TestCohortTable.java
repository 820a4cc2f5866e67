package sejirs.test;

import sejirs.*;

import org.junit.*;

import static org.junit.Assert.*;

public class TestCohortTable
{
	CohortTable table;
	
	@Before
	public void setUp() throws Exception
	{
		table = new CohortTable();
		table.add(Compartment.S, BehaviorClass.PLAIN, 0, 90);
		table.add(Compartment.S, BehaviorClass.PRUDENT, 3, 10);
		table.add(Compartment.E, BehaviorClass.VACCINATED, 1, 4);
		table.add(Compartment.I, BehaviorClass.PLAIN, 2, 5);
		table.add(Compartment.J4, BehaviorClass.PRUDENT_VACCINATED, 60, 1);
		table.add(Compartment.R, BehaviorClass.PLAIN, 7, 20);
	}
	
	@Test
	public void counts()
	{
		assertEquals(90, table.get(Compartment.S, BehaviorClass.PLAIN, 0));
		assertEquals(0, table.get(Compartment.S, BehaviorClass.PLAIN, 1));
		assertEquals(100, table.count(Compartment.S));
		assertEquals(10, table.count(Compartment.S, BehaviorClass.PRUDENT));
		assertEquals(130, table.living());
		assertEquals(10, table.active());
		assertEquals(0, table.minimum());
	}
	
	@Test
	public void copyIsIndependent()
	{
		CohortTable copy = table.copy();
		copy.add(Compartment.S, BehaviorClass.PLAIN, 0, -90);
		
		assertEquals(0, copy.get(Compartment.S, BehaviorClass.PLAIN, 0));
		assertEquals(90, table.get(Compartment.S, BehaviorClass.PLAIN, 0));
	}
	
	@Test
	public void negativeCountsVisibleInMinimum()
	{
		table.add(Compartment.R, BehaviorClass.PLAIN, 7, -21);
		assertEquals(-1, table.minimum());
	}
	
	@Test
	public void agingCapped()
	{
		assertEquals(1, CohortTable.older(0));
		assertEquals(CohortTable.MAX_TRACKED_DAYS, CohortTable.older(CohortTable.MAX_TRACKED_DAYS - 1));
		assertEquals(CohortTable.MAX_TRACKED_DAYS, CohortTable.older(CohortTable.MAX_TRACKED_DAYS));
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void noDeceasedCells()
	{
		table.get(Compartment.DECEASED, BehaviorClass.PLAIN, 0);
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void daysOutOfRange()
	{
		table.add(Compartment.S, BehaviorClass.PLAIN, CohortTable.MAX_TRACKED_DAYS + 1, 1);
	}
}
