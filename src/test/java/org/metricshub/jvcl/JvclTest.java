package org.metricshub.jvcl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jvcl.VclTestSupport.ifThen;
import static org.metricshub.jvcl.VclTestSupport.inlineIf;
import static org.metricshub.jvcl.VclTestSupport.num;
import static org.metricshub.jvcl.VclTestSupport.program;
import static org.metricshub.jvcl.VclTestSupport.ret;
import static org.metricshub.jvcl.VclTestSupport.set;
import static org.metricshub.jvcl.VclTestSupport.str;
import static org.metricshub.jvcl.VclTestSupport.sub;
import static org.metricshub.jvcl.VclTestSupport.var;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.jvcl.coverage.CoverageRegistry;
import org.metricshub.jvcl.coverage.CoverageReport;
import org.metricshub.jvcl.coverage.CoverageType;
import org.metricshub.jvcl.frontend.ast.VclFormatter;
import org.metricshub.jvcl.frontend.ast.VclProgram;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.util.JvclSettings;

public class JvclTest {

	private static VclProgram recv() {
		return program(
				sub(
						1,
						"vcl_recv",
						ifThen(2, 3, var("req.http.Debug"), set(3, 5, "req.http.X-Debug", str("on"))).build(),
						set(4, 3, "req.http.X-Ok", num(1)),
						ret(5, 3, "lookup")));
	}

	@Test
	public void testRunAndPrintCoverage() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		JvclSettings settings = new JvclSettings();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		Jvcl jvcl = new Jvcl(settings);

		VclContext context = jvcl.run(recv(), "vcl_recv");

		assertEquals(1L, context.get("req.http.X-Ok"));
		CoverageReport report = jvcl.printCoverage(context.getCoverage());
		assertEquals(4, report.getTotal(CoverageType.STATEMENT));
		assertEquals(3, report.getCovered(CoverageType.STATEMENT));

		String nl = System.lineSeparator();
		assertEquals(
				"Subroutines: 1/1 (100.0%)" + nl + "Statements: 3/4 (75.0%)" + nl + "Branches: 0/1 (0.0%)" + nl,
				out.toString(StandardCharsets.UTF_8.name()));
	}

	@Test
	public void testCoverageDisabled() {
		JvclSettings settings = new JvclSettings();
		settings.setCoverageEnabled(false);
		VclProgram program = recv();
		String before = VclFormatter.format(program);

		VclContext context = new Jvcl(settings).run(program, "vcl_recv");

		assertEquals(0, context.getCoverage().size());
		assertEquals(before, VclFormatter.format(program));
		assertEquals(1L, context.get("req.http.X-Ok"));
	}

	@Test
	public void testInstrumentThenExecute() {
		Jvcl jvcl = new Jvcl();
		VclProgram program = recv();
		CoverageRegistry registry = jvcl.instrument(program);

		VclContext first = new VclContext(registry);
		first.set("req.http.Debug", "1");
		assertEquals("lookup", jvcl.execute(program, "vcl_recv", first));
		assertEquals("on", first.get("req.http.X-Debug"));

		VclContext second = new VclContext(registry);
		assertEquals("lookup", jvcl.execute(program, "vcl_recv", second));

		assertEquals(2L, registry.getEntry("sub_1_1").getHits());
		assertEquals(1L, registry.getEntry("branch_2_3_1").getHits());
		assertEquals(100.0, registry.report().getPercentage(CoverageType.BRANCH), 0.0);
	}

	@Test
	public void testRunSameProgramTwice() {
		VclProgram program = program(
				sub(
						1,
						"vcl_recv",
						ifThen(2, 3, var("req.http.A"), set(3, 5, "x", num(1)))
								.elseIf("elsif", 4, 5, var("req.http.B"), set(5, 7, "x", num(2)))
								.orElse(6, 5, set(7, 7, "x", num(3)))
								.build(),
						set(9, 3, "y", inlineIf(9, 11, var("req.http.C"), str("c"), str("none")))));
		Jvcl jvcl = new Jvcl();

		VclContext first = jvcl.run(program, "vcl_recv");
		CoverageRegistry registry = first.getCoverage();
		int size = registry.size();
		String instrumented = VclFormatter.format(program);

		VclContext second = jvcl.run(program, "vcl_recv");

		assertSame(registry, second.getCoverage());
		assertSame(registry, program.getCoverage());
		assertEquals(size, registry.size());
		assertEquals(instrumented, VclFormatter.format(program));
		assertEquals(3L, second.get("x"));
		assertEquals("none", second.get("y"));
		assertEquals(2L, registry.getEntry("sub_1_1").getHits());
		assertEquals(2L, registry.getEntry("branch_2_3_3").getHits());
		assertEquals(2L, registry.getEntry("branch_9_11_false").getHits());
		assertNull(registry.getEntry("stmt_0_0"));
	}

	@Test
	public void testSettings() {
		JvclSettings settings = new JvclSettings();
		assertTrue(settings.isCoverageEnabled());
		assertEquals(100, settings.getMaxCallStackDepth());
		assertEquals("coverageEnabled = true\nmaxCallStackDepth = 100\n", settings.toDescriptionString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidMaxCallStackDepth() {
		new JvclSettings().setMaxCallStackDepth(0);
	}
}
