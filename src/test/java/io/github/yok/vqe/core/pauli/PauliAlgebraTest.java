package io.github.yok.vqe.core.pauli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.vqe.core.exception.DimensionMismatchException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class PauliAlgebraTest {

    private static final double EPS = 1e-12;

    @Test
    void singleQubitProductsFollowPauliRelations() {
        assertProduct("X", "Y", "Z", 1);
        assertProduct("Y", "X", "Z", 3);
        assertProduct("Y", "Z", "X", 1);
        assertProduct("Z", "Y", "X", 3);
        assertProduct("Z", "X", "Y", 1);
        assertProduct("X", "Z", "Y", 3);
    }

    @Test
    void everyTermSquaresToIdentity() {
        for (PauliTerm t : allTerms(2)) {
            PauliProduct p = PauliAlgebra.multiply(t, t);
            assertTrue(p.getTerm().isIdentity(), t.toLabel());
            assertEquals(0, p.getPhase(), t.toLabel());
        }
    }

    @Test
    void anticommutingTermsDifferByMinusOne() {
        for (PauliTerm a : allTerms(2)) {
            for (PauliTerm b : allTerms(2)) {
                int ab = PauliAlgebra.multiply(a, b).getPhase();
                int ba = PauliAlgebra.multiply(b, a).getPhase();
                int expected = a.commutesWith(b) ? 0 : 2;
                assertEquals(expected, Math.floorMod(ab - ba, 4), a + " " + b);
            }
        }
    }

    @Test
    void multiplicationIsAssociative() {
        List<PauliTerm> terms = allTerms(2);
        for (PauliTerm a : terms) {
            for (PauliTerm b : terms) {
                for (PauliTerm c : terms) {
                    PauliProduct ab = PauliAlgebra.multiply(a, b);
                    PauliProduct abC = PauliAlgebra.multiply(ab.getTerm(), c);
                    PauliProduct bc = PauliAlgebra.multiply(b, c);
                    PauliProduct aBc = PauliAlgebra.multiply(a, bc.getTerm());

                    assertEquals(abC.getTerm(), aBc.getTerm());
                    assertEquals(Math.floorMod(ab.getPhase() + abC.getPhase(), 4),
                            Math.floorMod(bc.getPhase() + aBc.getPhase(), 4));
                }
            }
        }
    }

    @Test
    void composeAppliesPhaseToCoefficients() {
        PauliSum x = PauliSum.of(PauliTerm.parse("X"), new Complex(2.0, 0.0));
        PauliSum y = PauliSum.of(PauliTerm.parse("Y"), new Complex(0.5, 0.0));

        PauliSum xy = PauliAlgebra.compose(x, y);

        assertEquals(1, xy.size());
        Complex c = xy.coefficient(PauliTerm.parse("Z"));
        assertEquals(0.0, c.getReal(), EPS);
        assertEquals(1.0, c.getImaginary(), EPS);
    }

    @Test
    void composeCancelsOppositeContributions() {
        PauliSum sum = PauliSum.builder(1).add(PauliTerm.parse("X"), 1.0, 0.0)
                .add(PauliTerm.parse("Y"), 0.0, 1.0).build();

        // (X + iY)(X + iY) = I - I + i(XY + YX) = 0
        assertTrue(PauliAlgebra.compose(sum, sum).isEmpty());
    }

    @Test
    void adjointConjugatesCoefficients() {
        PauliSum sum = PauliSum.builder(2).add(PauliTerm.parse("XY"), 1.0, 2.0)
                .add(PauliTerm.parse("ZI"), -3.0, -0.5).build();

        PauliSum adj = PauliAlgebra.adjoint(sum);

        assertEquals(new Complex(1.0, -2.0), adj.coefficient(PauliTerm.parse("XY")));
        assertEquals(new Complex(-3.0, 0.5), adj.coefficient(PauliTerm.parse("ZI")));
        assertEquals(sum, PauliAlgebra.adjoint(adj));
    }

    @Test
    void anticommutatorOfAnticommutingTermsVanishes() {
        PauliSum x = PauliSum.of(PauliTerm.parse("X"), Complex.ONE);
        PauliSum z = PauliSum.of(PauliTerm.parse("Z"), Complex.ONE);

        assertTrue(PauliAlgebra.anticommutator(x, z).isEmpty());
        assertEquals(PauliSum.of(PauliTerm.identity(1), new Complex(2.0, 0.0)),
                PauliAlgebra.anticommutator(x, x));
    }

    @Test
    void simplifyIsIdempotentAndDropsNegligibleTerms() {
        PauliSum sum = PauliSum.builder(2).add(PauliTerm.parse("XX"), 0.25, 0.0)
                .add(PauliTerm.parse("XX"), 0.25, 0.0).add(PauliTerm.parse("ZZ"), 1e-15, 0.0)
                .add(PauliTerm.parse("IY"), 0.0, -1.0).build();

        PauliSum once = PauliAlgebra.simplify(sum);
        PauliSum twice = PauliAlgebra.simplify(once);

        assertEquals(once, twice);
        assertEquals(2, once.size());
        assertEquals(new Complex(0.5, 0.0), once.coefficient(PauliTerm.parse("XX")));
        assertEquals(Complex.ZERO, once.coefficient(PauliTerm.parse("ZZ")));
    }

    @Test
    void summationDoesNotDependOnInsertionOrder() {
        Random random = new Random(42L);
        List<PauliTerm> terms = allTerms(2);
        List<Object[]> contributions = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            contributions.add(new Object[] {terms.get(random.nextInt(terms.size())),
                    new Complex(random.nextGaussian() * 1e3, random.nextGaussian() * 1e-3)});
        }

        PauliSum forward = buildFrom(contributions);
        Collections.shuffle(contributions, new Random(7L));
        PauliSum shuffled = buildFrom(contributions);
        Collections.reverse(contributions);
        PauliSum reversed = buildFrom(contributions);

        for (PauliTerm t : terms) {
            assertEquals(forward.coefficient(t).getReal(), shuffled.coefficient(t).getReal(), 0.0);
            assertEquals(forward.coefficient(t).getImaginary(),
                    reversed.coefficient(t).getImaginary(), 0.0);
        }
        assertEquals(forward, shuffled);
        assertEquals(forward, reversed);
    }

    @Test
    void singleQubitMatricesMatchPauliMatrices() {
        ZMatrixRMaj y = PauliAlgebra.toMatrix(PauliSum.of(PauliTerm.parse("Y"), Complex.ONE), 1);

        assertEquals(0.0, y.getReal(0, 1), EPS);
        assertEquals(-1.0, y.getImag(0, 1), EPS);
        assertEquals(1.0, y.getImag(1, 0), EPS);
        assertEquals(0.0, y.getImag(0, 0), EPS);

        ZMatrixRMaj id = PauliAlgebra.toMatrix(PauliSum.identity(3), 3);
        for (int r = 0; r < 8; r++) {
            for (int c = 0; c < 8; c++) {
                assertEquals(r == c ? 1.0 : 0.0, id.getReal(r, c), EPS);
                assertEquals(0.0, id.getImag(r, c), EPS);
            }
        }
    }

    @Test
    void multiQubitMatrixIsKroneckerProductWithHighQubitFirst() {
        // "ZX" = Z (qubit 1) ⊗ X (qubit 0) = [[X, 0], [0, -X]]
        ZMatrixRMaj m = PauliAlgebra.toMatrix(PauliSum.of(PauliTerm.parse("ZX"), Complex.ONE), 2);

        double[][] expected = {
                {0, 1, 0, 0},
                {1, 0, 0, 0},
                {0, 0, 0, -1},
                {0, 0, -1, 0}};
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
                assertEquals(expected[r][c], m.getReal(r, c), EPS, "(" + r + "," + c + ")");
                assertEquals(0.0, m.getImag(r, c), EPS);
            }
        }
    }

    @Test
    void matrixOfProductEqualsProductOfMatrices() {
        PauliSum a = PauliSum.builder(2).add(PauliTerm.parse("XY"), 0.3, 0.1)
                .add(PauliTerm.parse("ZI"), -0.7, 0.0).build();
        PauliSum b = PauliSum.builder(2).add(PauliTerm.parse("YY"), 1.1, 0.0)
                .add(PauliTerm.parse("IX"), 0.0, 0.4).build();

        ZMatrixRMaj ab = PauliAlgebra.toMatrix(PauliAlgebra.compose(a, b), 2);
        ZMatrixRMaj ma = PauliAlgebra.toMatrix(a, 2);
        ZMatrixRMaj mb = PauliAlgebra.toMatrix(b, 2);

        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
                double re = 0.0;
                double im = 0.0;
                for (int k = 0; k < 4; k++) {
                    re += ma.getReal(r, k) * mb.getReal(k, c) - ma.getImag(r, k) * mb.getImag(k, c);
                    im += ma.getReal(r, k) * mb.getImag(k, c) + ma.getImag(r, k) * mb.getReal(k, c);
                }
                assertEquals(re, ab.getReal(r, c), 1e-12);
                assertEquals(im, ab.getImag(r, c), 1e-12);
            }
        }
    }

    @Test
    void widthMismatchIsRejected() {
        PauliTerm one = PauliTerm.parse("X");
        PauliTerm two = PauliTerm.parse("XX");

        assertThrows(DimensionMismatchException.class, () -> PauliAlgebra.multiply(one, two));
        assertThrows(DimensionMismatchException.class,
                () -> PauliAlgebra.compose(PauliSum.identity(1), PauliSum.identity(2)));
        assertThrows(DimensionMismatchException.class,
                () -> PauliAlgebra.toMatrix(PauliSum.identity(2), 3));
        assertThrows(DimensionMismatchException.class,
                () -> PauliSum.builder(1).add(two, Complex.ONE));
    }

    @Test
    void hermiticityIsJudgedFromImaginaryParts() {
        PauliSum hermitian = PauliSum.of(PauliTerm.parse("XZ"), new Complex(0.5, 0.0));
        PauliSum skew = PauliSum.of(PauliTerm.parse("XZ"), new Complex(0.5, 0.2));

        assertTrue(hermitian.isHermitian(1e-9));
        assertEquals(0.2, skew.maxImaginaryPart(), EPS);
        assertNotEquals(hermitian, skew);
    }

    private static void assertProduct(String a, String b, String term, int phase) {
        PauliProduct p = PauliAlgebra.multiply(PauliTerm.parse(a), PauliTerm.parse(b));
        assertEquals(PauliTerm.parse(term), p.getTerm(), a + b);
        assertEquals(phase, p.getPhase(), a + b);
    }

    private static List<PauliTerm> allTerms(int numQubits) {
        List<PauliTerm> terms = new ArrayList<>();
        int size = 1 << numQubits;
        for (long z = 0; z < size; z++) {
            for (long x = 0; x < size; x++) {
                terms.add(PauliTerm.of(numQubits, z, x));
            }
        }
        return terms;
    }

    private static PauliSum buildFrom(List<Object[]> contributions) {
        PauliSum.Builder b = PauliSum.builder(2);
        for (Object[] c : contributions) {
            b.add((PauliTerm) c[0], (Complex) c[1]);
        }
        return b.build();
    }
}
