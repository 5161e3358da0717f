package org.metricshub.jvcl.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jvcl.VclTestSupport.add;
import static org.metricshub.jvcl.VclTestSupport.append;
import static org.metricshub.jvcl.VclTestSupport.bool;
import static org.metricshub.jvcl.VclTestSupport.breakStmt;
import static org.metricshub.jvcl.VclTestSupport.call;
import static org.metricshub.jvcl.VclTestSupport.callFunction;
import static org.metricshub.jvcl.VclTestSupport.callSub;
import static org.metricshub.jvcl.VclTestSupport.caseMatching;
import static org.metricshub.jvcl.VclTestSupport.caseOf;
import static org.metricshub.jvcl.VclTestSupport.declareLocal;
import static org.metricshub.jvcl.VclTestSupport.defaultCase;
import static org.metricshub.jvcl.VclTestSupport.error;
import static org.metricshub.jvcl.VclTestSupport.fallthrough;
import static org.metricshub.jvcl.VclTestSupport.gotoLabel;
import static org.metricshub.jvcl.VclTestSupport.ifThen;
import static org.metricshub.jvcl.VclTestSupport.infix;
import static org.metricshub.jvcl.VclTestSupport.inlineIf;
import static org.metricshub.jvcl.VclTestSupport.label;
import static org.metricshub.jvcl.VclTestSupport.log;
import static org.metricshub.jvcl.VclTestSupport.num;
import static org.metricshub.jvcl.VclTestSupport.program;
import static org.metricshub.jvcl.VclTestSupport.restart;
import static org.metricshub.jvcl.VclTestSupport.ret;
import static org.metricshub.jvcl.VclTestSupport.set;
import static org.metricshub.jvcl.VclTestSupport.str;
import static org.metricshub.jvcl.VclTestSupport.sub;
import static org.metricshub.jvcl.VclTestSupport.switchOn;
import static org.metricshub.jvcl.VclTestSupport.synthetic;
import static org.metricshub.jvcl.VclTestSupport.syntheticBase64;
import static org.metricshub.jvcl.VclTestSupport.table;
import static org.metricshub.jvcl.VclTestSupport.unset;
import static org.metricshub.jvcl.VclTestSupport.var;
import static org.metricshub.jvcl.VclTestSupport.vclTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.metricshub.jvcl.VclTestSupport.TestResult;
import org.metricshub.jvcl.coverage.CoverageEntry;
import org.metricshub.jvcl.coverage.CoverageRegistry;
import org.metricshub.jvcl.coverage.CoverageReport;
import org.metricshub.jvcl.coverage.CoverageType;
import org.metricshub.jvcl.coverage.Instrumenter;
import org.metricshub.jvcl.ext.BuiltinRegistry;
import org.metricshub.jvcl.frontend.ast.VclProgram;
import org.metricshub.jvcl.jrt.TestingException;
import org.metricshub.jvcl.jrt.VclContext;
import org.metricshub.jvcl.jrt.VclRuntimeException;
import org.metricshub.jvcl.jrt.VclSystemException;
import org.metricshub.jvcl.util.JvclSettings;

public class InterpreterTest {

	/**
	 * <pre>
	 * sub vcl_recv {
	 *   if (a) { set x = 1; } else if (b) { set x = 2; } else { set x = 3; }
	 * }
	 * </pre>
	 */
	private static VclProgram ifChain() {
		return program(
				sub(
						1,
						"vcl_recv",
						ifThen(2, 3, var("a"), set(3, 5, "x", num(1)))
								.elseIf(4, 5, var("b"), set(5, 7, "x", num(2)))
								.orElse(6, 5, set(7, 7, "x", num(3)))
								.build()));
	}

	@Test
	public void testIfChainBranchCoverage() {
		vclTest("first clause")
				.program(InterpreterTest::ifChain)
				.variable("a", true)
				.expectCovered("sub_1_1", "stmt_2_3", "branch_2_3_1", "stmt_3_5")
				.expectUncovered("branch_2_3_2", "branch_4_5_1", "branch_2_3_3", "stmt_5_7", "stmt_7_7")
				.runAndAssert();

		vclTest("else-if clause")
				.program(InterpreterTest::ifChain)
				.variable("b", "yes")
				.expectCovered("branch_2_3_2", "branch_4_5_1", "stmt_5_7")
				.expectUncovered("branch_2_3_1", "branch_2_3_3")
				.runAndAssert();

		vclTest("else clause")
				.program(InterpreterTest::ifChain)
				.expectCovered("branch_2_3_2", "branch_2_3_3", "stmt_7_7")
				.expectUncovered("branch_2_3_1", "branch_4_5_1")
				.expectVariable("x", 3L)
				.runAndAssert();
	}

	@Test
	public void testInlineConditional() {
		vclTest("set req.http.Foo = if(req.http.Bar, \"a\", \"b\")")
				.program(
						() -> program(
								sub(
										1,
										"vcl_recv",
										set(2, 3, "req.http.Foo", inlineIf(2, 24, var("req.http.Bar"), str("a"), str("b"))))))
				.variable("req.http.Bar", "1")
				.expectVariable("req.http.Foo", "a")
				.expectCovered("stmt_2_3", "branch_2_24_true")
				.expectUncovered("branch_2_24_false")
				.runAndAssert();
	}

	private static VclProgram switchProgram() {
		return program(
				sub(
						1,
						"vcl_recv",
						switchOn(
								2,
								3,
								var("req.http.X"),
								caseOf(3, 5, "a", set(4, 7, "y", str("A")), fallthrough(5, 7)),
								caseMatching(6, 5, "^b", append(7, 7, "y", str("B")), breakStmt(8, 7)),
								defaultCase(9, 5, set(10, 7, "y", str("D")))),
						set(11, 3, "after", bool(true))));
	}

	@Test
	public void testSwitchFallthrough() {
		vclTest("fallthrough into the next clause")
				.program(InterpreterTest::switchProgram)
				.variable("req.http.X", "a")
				.expectVariable("y", "AB")
				.expectVariable("after", true)
				.expectCovered("branch_2_3_1", "branch_3_5", "branch_2_3_2", "branch_6_5", "stmt_8_7")
				.expectUncovered("branch_2_3_3", "branch_9_5")
				.runAndAssert();
	}

	@Test
	public void testSwitchRegexAndDefault() {
		vclTest("regular expression clause")
				.program(InterpreterTest::switchProgram)
				.variable("req.http.X", "bar")
				.expectVariable("y", "B")
				.expectUncovered("branch_2_3_1", "branch_2_3_3")
				.runAndAssert();

		vclTest("default clause")
				.program(InterpreterTest::switchProgram)
				.variable("req.http.X", "zzz")
				.expectVariable("y", "D")
				.expectCovered("branch_2_3_3", "branch_9_5")
				.expectUncovered("branch_2_3_1", "branch_2_3_2")
				.runAndAssert();
	}

	@Test
	public void testGoto() {
		vclTest("goto skips statements")
				.program(
						() -> program(
								sub(
										1,
										"vcl_recv",
										set(2, 3, "n", num(0)),
										gotoLabel(3, 3, "end"),
										set(4, 3, "n", num(1)),
										label(5, 1, "end"),
										set(6, 3, "m", num(2)))))
				.expectVariable("n", 0L)
				.expectVariable("m", 2L)
				.expectCovered("stmt_3_3", "stmt_6_3")
				.expectUncovered("stmt_4_3")
				.runAndAssert();
	}

	@Test
	public void testGotoFromNestedBlock() {
		vclTest("goto out of an if statement")
				.program(
						() -> program(
								sub(
										1,
										"vcl_recv",
										ifThen(2, 3, bool(true), gotoLabel(3, 5, "done")).build(),
										set(4, 3, "skipped", num(1)),
										label(5, 1, "done"))))
				.expectVariable("skipped", null)
				.runAndAssert();
	}

	@Test
	public void testUnknownGotoDestination() {
		vclTest("unknown goto destination")
				.program(() -> program(sub(1, "vcl_recv", gotoLabel(2, 3, "nowhere"))))
				.expectThrow(VclRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testCallSubroutine() {
		TestResult result = vclTest("call another subroutine")
				.program(
						() -> program(
								sub(1, "vcl_recv", callSub(2, 3, "helper"), set(3, 3, "after", str("yes"))),
								sub(10, "helper", set(11, 3, "h", str("1")), ret(12, 3, "lookup"), set(13, 3, "h", str("2")))))
				.expectVariable("h", "1")
				.expectVariable("after", "yes")
				.expectAction(null)
				.expectCovered("sub_1_1", "sub_10_1", "stmt_12_3")
				.expectUncovered("stmt_13_3")
				.runAndAssert();
		assertEquals(1L, result.registry().getEntry("sub_10_1").getHits());
	}

	@Test
	public void testMaxCallStack() {
		TestResult result = vclTest("recursive call")
				.program(() -> program(sub(1, "vcl_recv", callSub(2, 3, "vcl_recv"))))
				.maxCallStackDepth(5)
				.expectThrow(VclRuntimeException.class)
				.runAndAssert();
		String message = result.thrownException().getMessage();
		assertTrue(message, message.contains("max call stack exceeded"));
		assertTrue(message, message.contains("vcl_recv in main.vcl:1"));
	}

	@Test
	public void testError() {
		TestResult result = vclTest("error statement")
				.program(
						() -> program(
								sub(
										1,
										"vcl_recv",
										error(2, 3, num(404), str("Not found")),
										set(3, 3, "x", num(1)))))
				.expectAction("error")
				.expectVariable("x", null)
				.expectUncovered("stmt_3_3")
				.runAndAssert();
		assertEquals(404L, result.context().getErrorStatus());
		assertEquals("Not found", result.context().getErrorMessage());
	}

	@Test
	public void testErrorWithoutCode() {
		TestResult result = vclTest("error without code")
				.program(() -> program(sub(1, "vcl_recv", error(2, 3, null, null))))
				.expectAction("error")
				.runAndAssert();
		assertEquals(503L, result.context().getErrorStatus());
		assertNull(result.context().getErrorMessage());
	}

	@Test
	public void testErrorCodeMustBeInteger() {
		vclTest("error with a string code")
				.program(() -> program(sub(1, "vcl_recv", error(2, 3, str("404"), null))))
				.expectThrow(VclRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testReturnAndRestart() {
		vclTest("return(pass)")
				.program(() -> program(sub(1, "vcl_recv", ret(2, 3, "pass"), set(3, 3, "x", num(1)))))
				.expectAction("pass")
				.expectVariable("x", null)
				.runAndAssert();

		TestResult result = vclTest("restart")
				.program(() -> program(sub(1, "vcl_recv", restart(2, 3))))
				.expectAction("restart")
				.runAndAssert();
		assertTrue(result.context().isRestarted());
	}

	@Test
	public void testVariables() {
		TestResult result = vclTest("set, add, unset and locals")
				.program(
						() -> program(
								sub(
										1,
										"vcl_recv",
										declareLocal(2, 3, "var.tmp", "STRING"),
										set(3, 3, "var.tmp", str("local")),
										set(4, 3, "req.http.Copy", infix(var("var.tmp"), "+", str("!"))),
										add(5, 3, "req.http.Cookie", str("a=1")),
										add(6, 3, "req.http.Cookie", str("b=2")),
										set(7, 3, "req.http.Gone", str("x")),
										unset(8, 3, "req.http.Gone"),
										append(9, 3, "count", num(2)))))
				.variable("count", 40L)
				.expectVariable("req.http.Copy", "local!")
				.expectVariable("req.http.Cookie", "a=1, b=2")
				.expectVariable("req.http.Gone", null)
				.expectVariable("count", 42L)
				.runAndAssert();
		assertNull(result.context().get("var.tmp"));
		assertFalse(result.context().getVariables().containsKey("var.tmp"));
	}

	@Test
	public void testResponseAndLogs() {
		TestResult result = vclTest("synthetic responses and logs")
				.subroutine("vcl_error")
				.program(
						() -> program(
								sub(
										1,
										"vcl_error",
										log(2, 3, infix(str("status "), "+", num(200))),
										synthetic(3, 3, str("plain")),
										syntheticBase64(4, 3, str("aGVsbG8=")))))
				.runAndAssert();
		assertEquals("hello", result.context().getResponseBody());
		List<String> logs = new ArrayList<>();
		logs.add("status 200");
		assertEquals(logs, result.context().getLogs());
	}

	@Test
	public void testTablesLoaded() {
		TestResult result = vclTest("tables")
				.program(() -> program(table(1, "redirects", "/old", "/new"), sub(3, "vcl_recv")))
				.runAndAssert();
		assertEquals("/new", result.context().getTable("redirects").get("/old"));
	}

	@Test
	public void testFixedTimeFromProgram() {
		TestResult result = vclTest("testing.fixed_time")
				.program(() -> program(sub(1, "vcl_recv", callFunction(2, 3, "testing.fixed_time", num(86400)))))
				.runAndAssert();
		assertEquals(Instant.ofEpochSecond(86400), result.context().now());
	}

	@Test
	public void testFixedTimeMisuse() {
		vclTest("testing.fixed_time with a boolean")
				.program(() -> program(sub(1, "vcl_recv", callFunction(2, 3, "testing.fixed_time", bool(true)))))
				.expectThrow(TestingException.class)
				.runAndAssert();
	}

	@Test
	public void testUnknownFunctionAndSubroutine() {
		vclTest("unknown function")
				.program(() -> program(sub(1, "vcl_recv", set(2, 3, "x", call("std.nope")))))
				.expectThrow(VclRuntimeException.class)
				.runAndAssert();

		vclTest("unknown subroutine")
				.subroutine("vcl_fetch")
				.program(() -> program(sub(1, "vcl_recv")))
				.expectThrow(VclRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testMarkerNotRegistered() {
		VclProgram tree = ifChain();
		new Instrumenter(new CoverageRegistry()).instrument(tree);
		VclContext context = new VclContext(new CoverageRegistry());
		try {
			new Interpreter(tree, BuiltinRegistry.defaults(), new JvclSettings()).process("vcl_recv", context);
		} catch (VclSystemException e) {
			assertTrue(e.getMessage().contains("was never registered"));
			return;
		}
		throw new AssertionError("Markers must be registered in the registry of the context");
	}

	@Test
	public void testRegistryCompleteness() {
		TestResult result = vclTest("report after a partial run")
				.program(InterpreterTest::switchProgram)
				.variable("req.http.X", "zzz")
				.runAndAssert();

		CoverageRegistry registry = result.registry();
		CoverageReport report = registry.report();
		assertEquals(registry.size(), report.getLines().size());
		Set<String> ids = new HashSet<>();
		for (CoverageReport.Line line : report.getLines()) {
			assertTrue(ids.add(line.getId()));
			CoverageEntry entry = registry.getEntry(line.getId());
			assertEquals(entry.getHits(), line.getHits());
		}
		assertTrue(report.getCovered(CoverageType.BRANCH) < report.getTotal(CoverageType.BRANCH));
	}

	@Test
	public void testConcurrentRequests() throws Exception {
		VclProgram tree = ifChain();
		CoverageRegistry registry = new CoverageRegistry();
		new Instrumenter(registry).instrument(tree);
		Interpreter interpreter = new Interpreter(tree, BuiltinRegistry.defaults(), new JvclSettings());

		int requests = 200;
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 0; i < requests; i++) {
				final boolean a = i % 2 == 0;
				futures.add(executor.submit(() -> {
					VclContext context = new VclContext(registry);
					context.set("a", a);
					interpreter.process("vcl_recv", context);
					return context.get("x");
				}));
			}
			for (int i = 0; i < requests; i++) {
				assertEquals(i % 2 == 0 ? 1L : 3L, futures.get(i).get(30, TimeUnit.SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(requests, registry.getEntry("sub_1_1").getHits());
		assertEquals(requests / 2, registry.getEntry("branch_2_3_1").getHits());
		assertEquals(requests / 2, registry.getEntry("branch_2_3_3").getHits());
	}
}
