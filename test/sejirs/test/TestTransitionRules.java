package sejirs.test;

import java.util.*;

import sejirs.*;

import org.junit.*;

import static org.junit.Assert.*;

public class TestTransitionRules
{
	Config config;
	
	@Before
	public void setUp() throws Exception
	{
		config = new Config();
		config.randomSeed = 11;
		config.transmissionProbability = 0;
		config.recoveryRate = 0;
		config.symptomRate = 0;
		config.worseningRate = 0;
		config.hospitalDeathRate = 0;
		config.icuDeathRate = 0;
	}
	
	private SimulationContext context(int population, int hospital, int icu, int exposed, int infectious)
	{
		Config.ProvinceConfig province = new Config.ProvinceConfig("A", population, hospital, icu, infectious);
		province.initialExposed = exposed;
		config.addProvince(province);
		return new SimulationContext(Parameters.fromConfig(config));
	}
	
	private DayOutcome apply(SimulationContext context, int day) throws Exception
	{
		return new TransitionRules(context.getParameters()).apply(context, context.getProvinces().get(0), day);
	}
	
	@Test
	public void stayersAge() throws Exception
	{
		SimulationContext context = context(100, 0, 0, 0, 0);
		apply(context, 1);
		
		CohortTable cohorts = context.getProvinces().get(0).getCohorts();
		assertEquals(0, cohorts.get(Compartment.S, BehaviorClass.PLAIN, 0));
		assertEquals(100, cohorts.get(Compartment.S, BehaviorClass.PLAIN, 1));
	}
	
	@Test
	public void incubationWaitsForMinimumDays() throws Exception
	{
		config.incubationRate = 1.0;
		config.minIncubationDays = 2;
		SimulationContext context = context(100, 0, 0, 10, 0);
		Province province = context.getProvinces().get(0);
		
		apply(context, 1);
		apply(context, 2);
		assertEquals(10, province.count(Compartment.E));
		assertEquals(0, province.count(Compartment.I));
		
		apply(context, 3);
		assertEquals(0, province.count(Compartment.E));
		assertEquals(10, province.count(Compartment.I));
		assertEquals(10, province.getCohorts().get(Compartment.I, BehaviorClass.PLAIN, 0));
	}
	
	@Test
	public void exposuresCounted() throws Exception
	{
		config.transmissionProbability = 0.2;
		SimulationContext context = context(1000, 0, 0, 0, 100);
		Province province = context.getProvinces().get(0);
		
		DayOutcome outcome = apply(context, 1);
		assertTrue(outcome.getNewExposures() > 0);
		assertEquals(outcome.getNewExposures(), province.count(Compartment.E));
		assertEquals(1000, province.getLiving());
	}
	
	@Test
	public void blockedAdmissionsStay() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		SimulationContext context = context(100, 4, 0, 0, 10);
		Province province = context.getProvinces().get(0);
		
		DayOutcome outcome = apply(context, 1);
		assertEquals(4, province.count(Compartment.J3));
		assertEquals(4, province.getResources().getHospitalOccupied());
		assertEquals(6, province.count(Compartment.I));
		assertEquals(6, outcome.getDeniedHospital());
		assertEquals(6, province.getDeniedAdmissions(Severity.MODERATE));
		assertEquals(0, outcome.getDeaths());
		assertEquals(100, province.getLiving());
	}
	
	@Test
	public void degradedAdmissionsDie() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		config.admissionPolicy = AdmissionPolicy.DEGRADE;
		config.degradedFatality = 1.0;
		SimulationContext context = context(100, 0, 0, 0, 10);
		Province province = context.getProvinces().get(0);
		
		DayOutcome outcome = apply(context, 1);
		assertEquals(10, outcome.getDeaths());
		assertEquals(10, province.getCumulativeDeaths());
		assertEquals(10, province.count(Compartment.DECEASED));
		assertEquals(0, province.count(Compartment.I));
		assertEquals(90, province.getLiving());
	}
	
	@Test
	public void intensiveCareAdmissions() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 1.0;
		SimulationContext context = context(100, 50, 2, 0, 10);
		Province province = context.getProvinces().get(0);
		
		DayOutcome outcome = apply(context, 1);
		assertEquals(2, province.count(Compartment.J4));
		assertEquals(2, province.getResources().getIcuOccupied());
		assertEquals(0, province.getResources().getHospitalOccupied());
		assertEquals(8, outcome.getDeniedIcu());
		assertEquals(8, province.count(Compartment.I));
	}
	
	@Test
	public void transferReleasesHospitalBed() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		config.worseningRate = 1.0;
		config.vaccinationSeverityDiscount = 0.0;
		SimulationContext context = context(100, 5, 3, 0, 5);
		Province province = context.getProvinces().get(0);
		
		apply(context, 1);
		assertEquals(5, province.count(Compartment.J3));
		
		DayOutcome outcome = apply(context, 2);
		assertEquals(3, province.count(Compartment.J4));
		assertEquals(2, province.count(Compartment.J3));
		assertEquals(3, province.getResources().getIcuOccupied());
		assertEquals(2, province.getResources().getHospitalOccupied());
		assertEquals(2, outcome.getDeniedIcu());
	}
	
	@Test
	public void dischargeReleasesBeds() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		config.hospitalDischargeRate = 1.0;
		config.minHospitalDays = 1;
		SimulationContext context = context(100, 10, 0, 0, 6);
		Province province = context.getProvinces().get(0);
		
		apply(context, 1);
		assertEquals(6, province.getResources().getHospitalOccupied());
		
		apply(context, 2);
		assertEquals(6, province.getResources().getHospitalOccupied());
		
		apply(context, 3);
		assertEquals(0, province.count(Compartment.J3));
		assertEquals(6, province.count(Compartment.R));
		assertEquals(0, province.getResources().getHospitalOccupied());
	}
	
	@Test
	public void campaignVaccinatesSusceptibles() throws Exception
	{
		config.vaccinationCampaign = new Config.CampaignConfig(1, 1.0, 0.001);
		SimulationContext context = context(1000, 0, 0, 0, 100);
		Province province = context.getProvinces().get(0);
		
		DayOutcome outcome = apply(context, 1);
		CohortTable cohorts = province.getCohorts();
		int vaccinated = cohorts.count(Compartment.S, BehaviorClass.VACCINATED);
		
		assertEquals(900, cohorts.count(Compartment.S));
		assertEquals(outcome.getVaccinated(), vaccinated);
		assertTrue("Vaccinated: " + vaccinated, vaccinated >= 890);
		assertEquals(0, cohorts.count(Compartment.I, BehaviorClass.VACCINATED));
	}
	
	@Test
	public void campaignNotBeforeStartDay() throws Exception
	{
		config.vaccinationCampaign = new Config.CampaignConfig(5, 1.0, 0.001);
		SimulationContext context = context(1000, 0, 0, 0, 100);
		
		DayOutcome outcome = apply(context, 1);
		assertEquals(0, outcome.getVaccinated());
	}
	
	@Test
	public void waningImmunity() throws Exception
	{
		config.recoveryRate = 1.0;
		config.waningImmunity = true;
		config.waningRate = 1.0;
		SimulationContext context = context(100, 0, 0, 0, 10);
		Province province = context.getProvinces().get(0);
		
		apply(context, 1);
		assertEquals(10, province.count(Compartment.R));
		
		apply(context, 2);
		assertEquals(0, province.count(Compartment.R));
		assertEquals(100, province.count(Compartment.S));
	}
	
	@Test
	public void sameStreamSameOutcome() throws Exception
	{
		config.transmissionProbability = 0.2;
		config.symptomRate = 0.3;
		SimulationContext a = context(1000, 5, 1, 10, 50);
		SimulationContext b = new SimulationContext(a.getParameters());
		
		for(int day = 1; day <= 5; day++)
		{
			apply(a, day);
			apply(b, day);
			for(Compartment c : Compartment.values())
				assertEquals(a.getProvinces().get(0).count(c), b.getProvinces().get(0).count(c));
		}
	}

	@Test
	public void destinationsOrderedByCount() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		config.admissionPolicy = AdmissionPolicy.DEGRADE;
		config.degradedFatality = 1.0;
		SimulationContext context = context(100, 0, 0, 0, 10);
		Province province = context.getProvinces().get(0);
		
		apply(context, 1);
		assertEquals(10, province.getCumulativeDeaths());
		
		CohortTable cohorts = province.getCohorts();
		cohorts.add(Compartment.S, BehaviorClass.PLAIN, 1, -28);
		cohorts.add(Compartment.J4, BehaviorClass.PLAIN, 0, 3);
		cohorts.add(Compartment.J3, BehaviorClass.PLAIN, 0, 5);
		cohorts.add(Compartment.R, BehaviorClass.PLAIN, 0, 20);
		
		// E and I tie at 0 and keep declaration order; DECEASED ranks by its 10 deaths
		assertEquals(Arrays.asList(Compartment.E, Compartment.I, Compartment.J4, Compartment.J3,
			Compartment.DECEASED, Compartment.R, Compartment.S), TransitionRules.priorityOrder(province));
	}
	
	@Test
	public void tiesFollowDeclarationOrder() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		config.recoveryRate = 1.0;
		SimulationContext context = context(100, 10, 10, 0, 10);
		Province province = context.getProvinces().get(0);
		
		// J3, J4 and R are all empty: J3 is tried first and takes everyone
		apply(context, 1);
		assertEquals(10, province.count(Compartment.J3));
		assertEquals(0, province.count(Compartment.R));
	}
	
	@Test
	public void fewestFirstTakesEveryone() throws Exception
	{
		config.symptomRate = 1.0;
		config.severeFraction = 0.0;
		config.recoveryRate = 1.0;
		SimulationContext context = context(100, 10, 10, 0, 10);
		Province province = context.getProvinces().get(0);
		
		CohortTable cohorts = province.getCohorts();
		cohorts.add(Compartment.S, BehaviorClass.PLAIN, 0, -4);
		cohorts.add(Compartment.J3, BehaviorClass.PLAIN, 0, 2);
		cohorts.add(Compartment.J4, BehaviorClass.PLAIN, 0, 2);
		province.getResources().admit(Severity.MODERATE, 2);
		province.getResources().admit(Severity.SEVERE, 2);
		
		// R is now the emptiest destination and is certain, so nobody is hospitalized
		apply(context, 1);
		assertEquals(10, province.count(Compartment.R));
		assertEquals(0, province.count(Compartment.I));
		assertEquals(2, province.count(Compartment.J3));
		assertEquals(2, province.count(Compartment.J4));
		assertEquals(2, province.getResources().getHospitalOccupied());
		assertEquals(100, province.getLiving());
	}
}
