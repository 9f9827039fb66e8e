package io.github.yok.vqe.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.fermion.FermionOperator;
import io.github.yok.vqe.core.fermion.JordanWignerMapper;
import io.github.yok.vqe.core.hamiltonian.HamiltonianBuilder;
import io.github.yok.vqe.core.hamiltonian.MolecularIntegrals;
import io.github.yok.vqe.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.vqe.core.pauli.PauliSum;
import io.github.yok.vqe.core.pauli.PauliTerm;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class ExactSolverTest {

    private final ExactSolver solver =
            new ExactSolver(new EjmlSymmetricEigenDecompositionBackend());

    @Test
    void singleOccupiedOrbitalHasEnergyMinusOne() {
        JordanWignerMapper mapper = new JordanWignerMapper();
        List<FermionOperator> ann = mapper.annihilationOperators(1);
        List<FermionOperator> cre = mapper.creationOperators(ann);
        PauliSum h = new HamiltonianBuilder().build(new Complex[][] {{new Complex(-1.0, 0.0)}},
                MolecularIntegrals.zeroTwoBody(1), ann, cre);

        assertEquals(-1.0, solver.minimalEigenvalue(h, 1), 1e-10);
    }

    @Test
    void groundStateAndGapOfTwoQubitHamiltonian() {
        // Z0 + 0.5 Z1: 固有値 -1.5, -0.5, 0.5, 1.5。基底状態は |11>
        PauliSum h = PauliSum.builder(2).add(PauliTerm.parse("IZ"), 1.0, 0.0)
                .add(PauliTerm.parse("ZI"), 0.5, 0.0).build();

        ExactSolver.ExactSolution s = solver.solve(h, 2, true);

        assertEquals(-1.5, s.getMinimalEigenvalue(), 1e-10);
        assertEquals(1.0, s.getSpectralGap(), 1e-10);
        double[] psi = s.getGroundState();
        assertEquals(8, psi.length);
        double p3 = psi[6] * psi[6] + psi[7] * psi[7];
        assertEquals(1.0, p3, 1e-10);
    }

    @Test
    void groundStateIsOmittedWhenNotRequested() {
        ExactSolver.ExactSolution s =
                solver.solve(PauliSum.of(PauliTerm.parse("X"), Complex.ONE), 1, false);

        assertEquals(-1.0, s.getMinimalEigenvalue(), 1e-10);
        assertNull(s.getGroundState());
    }

    @Test
    void complexCoefficientsOfHermitianFormAreHandled() {
        // 0.5 (X + Y) は固有値 ±1/√2
        PauliSum h = PauliSum.builder(1).add(PauliTerm.parse("X"), 0.5, 0.0)
                .add(PauliTerm.parse("Y"), 0.5, 0.0).build();

        assertEquals(-Math.sqrt(0.5), solver.minimalEigenvalue(h, 1), 1e-10);
    }

    @Test
    void smallImaginaryResidueIsDroppedInsteadOfRejected() {
        PauliSum h = PauliSum.of(PauliTerm.parse("X"), new Complex(1.0, 2e-9));

        assertEquals(-1.0, solver.minimalEigenvalue(h, 1), 1e-10);
    }

    @Test
    void nonHermitianHamiltonianIsReducedToItsHermitianPart() {
        // Z + i·X のエルミート部分は Z
        PauliSum h = PauliSum.builder(1).add(PauliTerm.parse("Z"), 1.0, 0.0)
                .add(PauliTerm.parse("X"), 0.0, 1.0).build();

        assertEquals(-1.0, solver.minimalEigenvalue(h, 1), 1e-10);
    }

    @Test
    void groundStateCannotBeModifiedThroughTheResult() {
        ExactSolver.ExactSolution s =
                solver.solve(PauliSum.of(PauliTerm.parse("Z"), Complex.ONE), 1, true);

        s.getGroundState()[0] = 99.0;

        assertNotEquals(99.0, s.getGroundState()[0]);
    }

    @Test
    void widthMismatchIsRejected() {
        assertThrows(DimensionMismatchException.class,
                () -> solver.minimalEigenvalue(PauliSum.identity(2), 3));
    }
}
