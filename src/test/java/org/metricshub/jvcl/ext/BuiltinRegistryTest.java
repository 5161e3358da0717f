package org.metricshub.jvcl.ext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jvcl.VclTestSupport.esi;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.jvcl.coverage.CoverageRegistry;
import org.metricshub.jvcl.coverage.CoverageType;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.jrt.VclRuntimeException;
import org.metricshub.jvcl.jrt.VclSystemException;

public class BuiltinRegistryTest {

	@Test
	public void testDefaults() {
		BuiltinRegistry registry = BuiltinRegistry.defaults();

		List<String> names = new ArrayList<>(registry.getFunctions().keySet());
		List<String> expected = new ArrayList<>();
		expected.add("coverage.subroutine");
		expected.add("coverage.statement");
		expected.add("coverage.branch");
		expected.add("testing.fixed_time");
		assertEquals(expected, names);
		assertTrue(registry.contains("coverage.branch"));
		assertNull(registry.lookup("std.log"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateName() {
		BuiltinRegistry.of(new CoverageFunction(CoverageType.BRANCH), new CoverageFunction(CoverageType.BRANCH));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testImmutable() {
		BuiltinRegistry.defaults().getFunctions().clear();
	}

	@Test
	public void testCoverageFunctionHit() {
		CoverageRegistry coverage = new CoverageRegistry();
		coverage.setupBranch("branch_1_1_1", esi(1, 1));
		VclContext context = new VclContext(coverage);

		BuiltinRegistry.defaults().lookup("coverage.branch").call(context, new Object[] { "branch_1_1_1" });

		assertEquals(1, coverage.getEntry("branch_1_1_1").getHits());
	}

	@Test(expected = VclSystemException.class)
	public void testCoverageFunctionUnknownMarker() {
		new CoverageFunction(CoverageType.STATEMENT)
				.call(new VclContext(new CoverageRegistry()), new Object[] { "stmt_1_1" });
	}

	@Test(expected = VclSystemException.class)
	public void testCoverageFunctionNotAString() {
		new CoverageFunction(CoverageType.STATEMENT).call(new VclContext(new CoverageRegistry()), new Object[] { 1L });
	}

	@Test
	public void testArityChecked() {
		try {
			new CoverageFunction(CoverageType.SUBROUTINE).call(new VclContext(new CoverageRegistry()), new Object[0]);
		} catch (VclRuntimeException e) {
			assertEquals("Function 'coverage.subroutine' expects 1 argument(s), not 0", e.getReason());
			return;
		}
		throw new AssertionError("Arity must be checked");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyName() {
		new BuiltinFunction(" ", 0) {
			@Override
			protected Object invoke(VclContext context, Object[] args) {
				return null;
			}
		};
	}
}
