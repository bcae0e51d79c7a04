package edu.isi.molsynth;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TransformationTest {

    @Test
    public void splitsAtFirstArrow() throws Exception {
	Transformation t = Transformation.parse("Al => ThF");
	assertEquals("Al", t.getSource());
	assertEquals("ThF", t.getReplacement());
	assertEquals("Al => ThF", t.toString());
	assertEquals(" => x", Transformation.parse("a =>  => x").getReplacement());
    }

    @Test
    public void reverseSwapsSides() throws Exception {
	Transformation t = new Transformation("H", "OH");
	assertEquals(new Transformation("OH", "H"), t.reverse());
	assertEquals(t, t.reverse().reverse());
    }

    @Test
    public void rejectsLinesWithoutArrow() {
	assertFalse(Transformation.isRuleLine("H=>HO"));
	assertThrows(DataFormatException.class, () -> Transformation.parse("H=>HO"));
    }
}
