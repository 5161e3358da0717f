package org.metricshub.jvcl.ext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jvcl.coverage.CoverageRegistry;
import org.metricshub.jvcl.jrt.ExceptionType;
import org.metricshub.jvcl.jrt.TestingException;
import org.metricshub.jvcl.jrt.VclContext;

public class TestingFixedTimeFunctionTest {

	private final TestingFixedTimeFunction function = new TestingFixedTimeFunction();
	private VclContext context;

	@Before
	public void setUp() {
		context = new VclContext(new CoverageRegistry());
	}

	@Test
	public void testUnixTime() {
		assertNull(function.call(context, new Object[] { 1700000000L }));
		assertEquals(Instant.ofEpochSecond(1700000000L), context.now());
	}

	@Test
	public void testTime() {
		Instant instant = Instant.parse("2021-06-01T10:00:00Z");
		function.call(context, new Object[] { instant });
		assertEquals(instant, context.getFixedTime());
	}

	@Test
	public void testString() {
		function.call(context, new Object[] { "2024-01-02 03:04:05" });
		assertEquals(Instant.parse("2024-01-02T03:04:05Z"), context.now());
	}

	@Test
	public void testInvalidString() {
		try {
			function.call(context, new Object[] { "2024-01-02T03:04:05" });
			fail("ISO format is not accepted");
		} catch (TestingException e) {
			assertTrue(e.getReason(), e.getReason().startsWith("Invalid time format: "));
			assertTrue(e.getCause() != null);
		}
		assertNull(context.getFixedTime());
	}

	@Test
	public void testInvalidType() {
		try {
			function.call(context, new Object[] { Boolean.TRUE });
			fail("BOOL is not accepted");
		} catch (TestingException e) {
			assertEquals(ExceptionType.RUNTIME, e.getType());
			assertEquals(
					"[RuntimeException] First argument of testing.fixed_time must be INTEGER or TIME or STRING type, BOOL provided",
					e.getMessage());
		}
	}

	@Test
	public void testArity() {
		try {
			function.call(context, new Object[0]);
			fail("One argument is required");
		} catch (TestingException e) {
			assertEquals("testing.fixed_time function requires 1 argument(s) but 0 provided", e.getReason());
		}
		try {
			function.call(context, new Object[] { 1L, 2L });
			fail("One argument only");
		} catch (TestingException e) {
			assertEquals("testing.fixed_time function requires 1 argument(s) but 2 provided", e.getReason());
		}
	}
}
