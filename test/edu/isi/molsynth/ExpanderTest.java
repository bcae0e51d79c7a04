package edu.isi.molsynth;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class ExpanderTest {

    static TransformationSet water(String target) throws DataFormatException {
	return new TransformationSet(Arrays.asList(
		"e => H", "e => O", "H => HO", "H => OH", "O => HH", "", target));
    }

    @Test
    public void oneStepFromHOH() throws Exception {
	TransformationSet ts = water("HOH");
	Set<String> next = Expander.expand(ts.getTarget(), ts);
	assertEquals(new HashSet<String>(Arrays.asList("HOOH", "HOHO", "OHOH", "HHHH")), next);
	assertEquals(4, Expander.count(ts.getTarget(), ts));
    }

    @Test
    public void oneStepFromHOHOHO() throws Exception {
	TransformationSet ts = water("HOHOHO");
	assertEquals(7, Expander.count(ts.getTarget(), ts));
    }

    @Test
    public void overlappingOccurrencesCountSeparately() throws Exception {
	TransformationSet ts = new TransformationSet(Arrays.asList("aa => b", "aaa"));
	assertEquals(new HashSet<String>(Arrays.asList("ba", "ab")), Expander.expand("aaa", ts));
    }

    @Test
    public void duplicatesCollapse() throws Exception {
	// both rules and every position give the same molecule
	TransformationSet ts = new TransformationSet(Arrays.asList("a => b", "a => b", "c => b", "ac"));
	assertEquals(new HashSet<String>(Arrays.asList("bc", "ab")), Expander.expand("ac", ts));
	assertEquals(1, Expander.count("aa", new TransformationSet(Arrays.asList("a => aa", "x"))));
    }

    @Test
    public void orderOfRulesDoesNotMatter() throws Exception {
	TransformationSet a = new TransformationSet(Arrays.asList("H => HO", "H => OH", "O => HH", "x"));
	TransformationSet b = new TransformationSet(Arrays.asList("O => HH", "H => OH", "H => HO", "x"));
	assertEquals(Expander.expand("HOHOHO", a), Expander.expand("HOHOHO", b));
    }

    @Test
    public void noRulesNoExpansions() throws Exception {
	TransformationSet ts = new TransformationSet(Arrays.asList("HOH"));
	assertTrue(Expander.expand("HOH", ts).isEmpty());
    }

    @Test
    public void matchesBruteForce() throws Exception {
	TransformationSet ts = new TransformationSet(Arrays.asList(
		"Ca => CaCa", "Ca => PB", "B => TiB", "Ti => BP", "P => CaP", "x"));
	String molecule = "CaPTiBCaCaPB";
	Set<String> expected = new HashSet<String>();
	for (Transformation t : ts.getTransformations()) {
	    for (int i = 0; i + t.getSource().length() <= molecule.length(); i++) {
		if (molecule.regionMatches(i, t.getSource(), 0, t.getSource().length()))
		    expected.add(molecule.substring(0, i)+t.getReplacement()+molecule.substring(i+t.getSource().length()));
	    }
	}
	assertEquals(expected, Expander.expand(molecule, ts));
    }
}
