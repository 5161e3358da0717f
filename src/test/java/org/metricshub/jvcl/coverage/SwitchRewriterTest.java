package org.metricshub.jvcl.coverage;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jvcl.VclTestSupport.breakStmt;
import static org.metricshub.jvcl.VclTestSupport.caseMatching;
import static org.metricshub.jvcl.VclTestSupport.caseOf;
import static org.metricshub.jvcl.VclTestSupport.defaultCase;
import static org.metricshub.jvcl.VclTestSupport.set;
import static org.metricshub.jvcl.VclTestSupport.str;
import static org.metricshub.jvcl.VclTestSupport.switchOn;
import static org.metricshub.jvcl.VclTestSupport.var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jvcl.frontend.ast.Statement;
import org.metricshub.jvcl.frontend.ast.VclFormatter;

public class SwitchRewriterTest {

	private static Statement.SwitchStatement switchStatement() {
		return switchOn(
				10,
				3,
				var("req.http.X"),
				caseOf(11, 5, "a", set(12, 7, "y", str("A"))),
				caseMatching(13, 5, "^b", set(14, 7, "y", str("B")), breakStmt(15, 7)),
				defaultCase(16, 5, set(17, 7, "y", str("D"))));
	}

	@Test
	public void testOnePairOfBranchesPerCase() {
		CoverageRegistry registry = new CoverageRegistry();
		new Instrumenter(registry).instrumentStatements(Collections.singletonList(switchStatement()));

		List<String> ids = new ArrayList<>();
		for (CoverageEntry entry : registry.getEntries(CoverageType.BRANCH)) {
			ids.add(entry.getId());
		}
		List<String> expected = new ArrayList<>();
		expected.add("branch_10_3_1");
		expected.add("branch_11_5");
		expected.add("branch_10_3_2");
		expected.add("branch_13_5");
		expected.add("branch_10_3_3");
		expected.add("branch_16_5");
		assertEquals(expected, ids);
	}

	@Test
	public void testRewrittenTree() {
		List<Statement> statements = new Instrumenter(new CoverageRegistry())
				.instrumentStatements(Collections.singletonList(switchStatement()));

		String expected = "coverage.statement(\"stmt_10_3\");\n"
				+ "switch (req.http.X) {\n"
				+ "case \"a\":\n"
				+ "  coverage.branch(\"branch_10_3_1\");\n"
				+ "  coverage.branch(\"branch_11_5\");\n"
				+ "  coverage.statement(\"stmt_12_7\");\n"
				+ "  set y = \"A\";\n"
				+ "case ~ \"^b\":\n"
				+ "  coverage.branch(\"branch_10_3_2\");\n"
				+ "  coverage.branch(\"branch_13_5\");\n"
				+ "  coverage.statement(\"stmt_14_7\");\n"
				+ "  set y = \"B\";\n"
				+ "  coverage.statement(\"stmt_15_7\");\n"
				+ "  break;\n"
				+ "default:\n"
				+ "  coverage.branch(\"branch_10_3_3\");\n"
				+ "  coverage.branch(\"branch_16_5\");\n"
				+ "  coverage.statement(\"stmt_17_7\");\n"
				+ "  set y = \"D\";\n"
				+ "}\n";
		assertEquals(expected, VclFormatter.format(statements));
	}

	@Test
	public void testEmptySwitch() {
		CoverageRegistry registry = new CoverageRegistry();
		new Instrumenter(registry).instrumentStatements(Collections.singletonList(switchOn(1, 1, var("x"))));

		assertEquals(0, registry.getEntries(CoverageType.BRANCH).size());
		assertEquals(1, registry.getEntries(CoverageType.STATEMENT).size());
	}
}
