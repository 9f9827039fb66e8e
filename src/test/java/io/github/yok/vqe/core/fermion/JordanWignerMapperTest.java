package io.github.yok.vqe.core.fermion;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.vqe.core.exception.AlgebraInvariantException;
import io.github.yok.vqe.core.exception.DimensionMismatchException;
import io.github.yok.vqe.core.pauli.PauliSum;
import io.github.yok.vqe.core.pauli.PauliTerm;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

class JordanWignerMapperTest {

    private final JordanWignerMapper mapper = new JordanWignerMapper();

    @Test
    void annihilatorsCarryZStringBelowTheOrbital() {
        List<FermionOperator> ops = mapper.annihilationOperators(4);

        assertEquals(4, ops.size());
        for (FermionOperator op : ops) {
            assertEquals(FermionOperator.Kind.ANNIHILATION, op.getKind());
            assertEquals(2, op.getOperator().size());
            assertEquals(4, op.getOperator().numQubits());
        }

        PauliSum a2 = ops.get(2).getOperator();
        assertEquals(new Complex(0.5, 0.0), a2.coefficient(PauliTerm.parse("IXZZ")));
        assertEquals(new Complex(0.0, 0.5), a2.coefficient(PauliTerm.parse("IYZZ")));

        PauliSum a0 = ops.get(0).getOperator();
        assertEquals(new Complex(0.5, 0.0), a0.coefficient(PauliTerm.parse("IIIX")));
        assertEquals(new Complex(0.0, 0.5), a0.coefficient(PauliTerm.parse("IIIY")));
    }

    @Test
    void creatorsAreAdjointsOfAnnihilators() {
        List<FermionOperator> ann = mapper.annihilationOperators(3);
        List<FermionOperator> cre = mapper.creationOperators(ann);

        assertEquals(3, cre.size());
        PauliSum c1 = cre.get(1).getOperator();
        assertEquals(FermionOperator.Kind.CREATION, cre.get(1).getKind());
        assertEquals(new Complex(0.5, 0.0), c1.coefficient(PauliTerm.parse("IXZ")));
        assertEquals(new Complex(0.0, -0.5), c1.coefficient(PauliTerm.parse("IYZ")));
    }

    @Test
    void canonicalAnticommutationHolds() {
        List<FermionOperator> ann = mapper.annihilationOperators(4);
        List<FermionOperator> cre = mapper.creationOperators(ann);

        assertDoesNotThrow(() -> mapper.verifyAnticommutation(ann, cre));
    }

    @Test
    void operatorsWithoutParityStringAreRejected() {
        // Z 列のない局所的な演算子は異なる軌道どうしで可換になってしまう
        int n = 2;
        List<FermionOperator> ann = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            long site = 1L << i;
            PauliSum op = PauliSum.builder(n).add(PauliTerm.of(n, 0L, site), 0.5, 0.0)
                    .add(PauliTerm.of(n, site, site), 0.0, 0.5).build();
            ann.add(new FermionOperator(i, FermionOperator.Kind.ANNIHILATION, op));
        }
        List<FermionOperator> cre = mapper.creationOperators(ann);

        assertThrows(AlgebraInvariantException.class, () -> mapper.verifyAnticommutation(ann, cre));
    }

    @Test
    void mismatchedListsAreRejected() {
        List<FermionOperator> ann = mapper.annihilationOperators(3);
        List<FermionOperator> cre = mapper.creationOperators(mapper.annihilationOperators(2));

        assertThrows(DimensionMismatchException.class,
                () -> mapper.verifyAnticommutation(ann, cre));
        assertThrows(IllegalArgumentException.class, () -> mapper.creationOperators(cre));
        assertThrows(IllegalArgumentException.class, () -> mapper.annihilationOperators(0));
    }
}
