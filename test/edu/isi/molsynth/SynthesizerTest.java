package edu.isi.molsynth;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class SynthesizerTest {

    static TransformationSet water(String target) throws DataFormatException {
	return new TransformationSet(Arrays.asList(
		"e => H", "e => O", "H => HO", "H => OH", "O => HH", "", target));
    }

    @Test
    public void threeStepsToHOH() throws Exception {
	TransformationSet ts = water("HOH");
	Synthesizer syn = new Synthesizer(ts);
	List<Step> path = syn.synthesize("HOH");
	assertEquals(3, path.size());
	assertEquals(new Step(0, "e", "O"), path.get(0));
	assertEquals("HOH", StepApplicator.apply(Synthesizer.ELECTRON, path));
	assertTrue(syn.getNumExpanded() > 0);
    }

    @Test
    public void sixStepsToHOHOHO() throws Exception {
	TransformationSet ts = water("HOHOHO");
	Synthesizer syn = new Synthesizer(ts);
	List<Step> path = syn.synthesize(ts.getTarget());
	assertEquals(6, path.size());
	assertEquals("HOHOHO", StepApplicator.apply(Synthesizer.ELECTRON, path));
	assertEquals(6, syn.countSteps(ts.getTarget()));
    }

    @Test
    public void pathRoundTripsWithMultiCharacterFragments() throws Exception {
	TransformationSet ts = new TransformationSet(Arrays.asList(
		"e => CaF", "Ca => CaCa", "F => CaF", "Ca => PB", "P => CaP", "x"));
	Synthesizer syn = new Synthesizer(ts);
	String target = "CaPBCaCaF";
	List<Step> path = syn.synthesize(target);
	assertEquals(target, StepApplicator.apply(Synthesizer.ELECTRON, path));
	for (Step s : path)
	    assertTrue(ts.getTransformations().contains(new Transformation(s.getFrom(), s.getTo())));
    }

    @Test
    public void seedIsTarget() throws Exception {
	Synthesizer syn = new Synthesizer(water("e"));
	assertTrue(syn.synthesize("e").isEmpty());
	assertEquals(0, syn.getNumExpanded());
    }

    @Test
    public void otherSeed() throws Exception {
	Synthesizer syn = new Synthesizer(water("HOH"), "O", Synthesizer.DEFAULT_TIMEOUT);
	List<Step> path = syn.synthesize("HOH");
	assertEquals(2, path.size());
	assertEquals("HOH", StepApplicator.apply("O", path));
    }

    @Test
    public void noRulesNoSolution() throws Exception {
	Synthesizer syn = new Synthesizer(new TransformationSet(Arrays.asList("HOH")));
	NoSolutionException e = assertThrows(NoSolutionException.class, () -> syn.synthesize("HOH"));
	assertEquals(1, e.getNumExpanded());
    }

    @Test
    public void unreachableSeedNoSolution() throws Exception {
	// nothing reduces to e
	TransformationSet ts = new TransformationSet(Arrays.asList("H => HO", "H => OH", "O => HH", "HOHO"));
	assertThrows(NoSolutionException.class, () -> new Synthesizer(ts).synthesize("HOHO"));
    }

    @Test
    public void zeroBudgetTimesOut() throws Exception {
	Synthesizer syn = new Synthesizer(water("HOH"), Synthesizer.ELECTRON, 0);
	SearchTimeoutException e = assertThrows(SearchTimeoutException.class, () -> syn.synthesize("HOH"));
	assertEquals(0, e.getBudget());
    }

    @Test
    public void timeoutAndExhaustionAreBothSynthesisFailures() throws Exception {
	Synthesizer syn = new Synthesizer(water("HOH"), Synthesizer.ELECTRON, 0);
	SynthesisException late = assertThrows(SynthesisException.class, () -> syn.synthesize("HOH"));
	assertSame(SearchTimeoutException.class, late.getClass());
	Synthesizer none = new Synthesizer(new TransformationSet(Arrays.asList("HOH")));
	SynthesisException stuck = assertThrows(SynthesisException.class, () -> none.synthesize("HOH"));
	assertSame(NoSolutionException.class, stuck.getClass());
    }

    @Test
    public void badSettings() throws Exception {
	TransformationSet ts = water("HOH");
	assertThrows(ConfigureException.class, () -> new Synthesizer(ts, "e", -1));
	assertThrows(ConfigureException.class, () -> new Synthesizer(ts, "", 1000));
    }

    @Test
    public void reusableAcrossCalls() throws Exception {
	Synthesizer syn = new Synthesizer(water("HOH"));
	assertEquals(3, syn.synthesize("HOH").size());
	assertEquals(6, syn.synthesize("HOHOHO").size());
	assertEquals(1, syn.synthesize("H").size());
    }
}
