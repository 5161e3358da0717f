package org.metricshub.jvcl.frontend.ast;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jvcl.VclTestSupport.caseOf;
import static org.metricshub.jvcl.VclTestSupport.defaultCase;
import static org.metricshub.jvcl.VclTestSupport.error;
import static org.metricshub.jvcl.VclTestSupport.fallthrough;
import static org.metricshub.jvcl.VclTestSupport.ifThen;
import static org.metricshub.jvcl.VclTestSupport.infix;
import static org.metricshub.jvcl.VclTestSupport.inlineIf;
import static org.metricshub.jvcl.VclTestSupport.not;
import static org.metricshub.jvcl.VclTestSupport.num;
import static org.metricshub.jvcl.VclTestSupport.pos;
import static org.metricshub.jvcl.VclTestSupport.program;
import static org.metricshub.jvcl.VclTestSupport.ret;
import static org.metricshub.jvcl.VclTestSupport.set;
import static org.metricshub.jvcl.VclTestSupport.str;
import static org.metricshub.jvcl.VclTestSupport.sub;
import static org.metricshub.jvcl.VclTestSupport.switchOn;
import static org.metricshub.jvcl.VclTestSupport.table;
import static org.metricshub.jvcl.VclTestSupport.var;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class VclFormatterTest {

	@Test
	public void testProgram() {
		VclProgram program = program(
				table(1, "hosts", "a", "b"),
				sub(
						4,
						"vcl_recv",
						ifThen(5, 3, infix(var("req.http.Host"), "~", str("^www\\.")), set(6, 5, "x", num(1)))
								.elseIf("elsif", 7, 5, not(var("y")), ret(8, 7, "pass"))
								.orElse(9, 5, error(10, 7, num(403), null))
								.build(),
						switchOn(
								12,
								3,
								var("x"),
								caseOf(13, 5, "1", fallthrough(14, 7)),
								defaultCase(15, 5)),
						set(17, 3, "z", inlineIf(17, 11, var("x"), str("one"), str("other")))));

		String expected = "table hosts {\n"
				+ "  \"a\": \"b\",\n"
				+ "}\n"
				+ "\n"
				+ "sub vcl_recv {\n"
				+ "  if (req.http.Host ~ \"^www\\.\") {\n"
				+ "    set x = 1;\n"
				+ "  } elsif (!y) {\n"
				+ "    return(pass);\n"
				+ "  } else {\n"
				+ "    error 403;\n"
				+ "  }\n"
				+ "  switch (x) {\n"
				+ "  case \"1\":\n"
				+ "    fallthrough;\n"
				+ "  default:\n"
				+ "  }\n"
				+ "  set z = if(x, \"one\", \"other\");\n"
				+ "}\n";
		assertEquals(expected, VclFormatter.format(program));
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		set(1, 1, "req.http.A", str("b")).dump(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		assertEquals("set req.http.A = \"b\";\n", out.toString(StandardCharsets.UTF_8.name()));
	}

	@Test
	public void testSourcePosition() {
		assertEquals("main.vcl:3:4", pos(3, 4).toString());
		assertEquals("0:0", SourcePosition.SYNTHETIC.toString());
		assertEquals(pos(3, 4), pos(3, 4));
		assertEquals(pos(3, 4).hashCode(), pos(3, 4).hashCode());
	}
}
