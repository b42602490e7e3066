package my.rebalancer.app.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.security.test.web.servlet.setup.SecurityMockMvcConfigurers.springSecurity;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.rebalancer.app.AppApplication.class)
@ActiveProfiles("test")
class RebalancerApiIntegrationTest {
	private static final String EXAMPLE = """
			{
			  "holdings": [
			    {"ticker": "META", "price": 585, "shares": 50},
			    {"ticker": "AAPL", "price": 228, "shares": 100},
			    {"ticker": "NVDA", "price": 131, "shares": 200}
			  ],
			  "allocation": {"META": 0.40, "AAPL": 0.35, "NVDA": 0.25},
			  "cash": 2000.00,
			  "threshold": 0
			}
			""";

	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
	}

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context)
				.apply(springSecurity())
				.build();
	}

	@Test
	void rebalanceReturnsSellsBeforeBuys() throws Exception {
		mockMvc.perform(post("/api/rebalancer/rebalance")
						.contentType("application/json")
						.content(EXAMPLE)
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.trades.length()").value(3))
				.andExpect(jsonPath("$.trades[0].ticker").value("NVDA"))
				.andExpect(jsonPath("$.trades[0].action").value("SELL"))
				.andExpect(jsonPath("$.trades[0].value").value(6137.5))
				.andExpect(jsonPath("$.trades[1].ticker").value("AAPL"))
				.andExpect(jsonPath("$.trades[1].action").value("BUY"))
				.andExpect(jsonPath("$.trades[2].ticker").value("META"))
				.andExpect(jsonPath("$.netCashFlow").value(-2000.0))
				.andExpect(jsonPath("$.balanced").value(false))
				.andExpect(jsonPath("$.warnings").isEmpty());
	}

	@Test
	void summaryReportsTargets() throws Exception {
		mockMvc.perform(post("/api/rebalancer/summary")
						.contentType("application/json")
						.content(EXAMPLE)
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.totalValue").value(80250.0))
				.andExpect(jsonPath("$.positions[0].ticker").value("META"))
				.andExpect(jsonPath("$.targets.AAPL").value(28087.5));
	}

	@Test
	void invalidAllocationIsBadRequestWithCode() throws Exception {
		String body = """
				{
				  "holdings": [{"ticker": "A", "price": 100, "shares": 10}],
				  "allocation": {"A": 0.50, "B": 0.49}
				}
				""";

		mockMvc.perform(post("/api/rebalancer/rebalance")
						.contentType("application/json")
						.content(body)
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.code").value("ALLOCATION_SUM"))
				.andExpect(jsonPath("$.path").value("/api/rebalancer/rebalance"));
	}

	@Test
	void missingQuoteIsBadRequest() throws Exception {
		String body = """
				{
				  "holdings": [{"ticker": "A", "price": 100, "shares": 10}],
				  "allocation": {"A": 0.5, "GOOG": 0.5}
				}
				""";

		mockMvc.perform(post("/api/rebalancer/rebalance")
						.contentType("application/json")
						.content(body)
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.code").value("MISSING_PRICE"));
	}

	@Test
	void structurallyInvalidRequestFailsValidation() throws Exception {
		String body = """
				{
				  "holdings": [{"ticker": "", "price": 100, "shares": 10}],
				  "allocation": {"A": 1}
				}
				""";

		mockMvc.perform(post("/api/rebalancer/rebalance")
						.contentType("application/json")
						.content(body)
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.errors").isArray());
	}

	@Test
	void requiresAuthentication() throws Exception {
		mockMvc.perform(post("/api/rebalancer/rebalance")
						.contentType("application/json")
						.content(EXAMPLE))
				.andExpect(status().isUnauthorized());
	}

	@Test
	void backgroundRunCompletes() throws Exception {
		MvcResult started = mockMvc.perform(post("/api/rebalancer/run")
						.contentType("application/json")
						.content(EXAMPLE)
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.job_id").isString())
				.andReturn();

		String jobId = JsonHelper.read(started, "$.job_id").toString();
		MvcResult done = awaitJob(jobId);
		String json = done.getResponse().getContentAsString();
		assertThat(JsonHelper.read(json, "$.status")).isEqualTo("DONE");
		assertThat(JsonHelper.read(json, "$.result.trades[0].ticker")).isEqualTo("NVDA");
	}

	@Test
	void unknownRunIsNotFound() throws Exception {
		mockMvc.perform(get("/api/rebalancer/run/does-not-exist")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isNotFound());
	}

	private static final class JsonHelper {
		private static Object read(MvcResult result, String path) throws Exception {
			return read(result.getResponse().getContentAsString(), path);
		}

		private static Object read(String json, String path) {
			return com.jayway.jsonpath.JsonPath.read(json, path);
		}
	}

	private MvcResult awaitJob(String jobId) throws Exception {
		MvcResult result = null;
		for (int i = 0; i < 20; i++) {
			result = mockMvc.perform(get("/api/rebalancer/run/" + jobId)
							.with(httpBasic("admin", "admin")))
					.andExpect(status().isOk())
					.andReturn();
			String status = JsonHelper.read(result, "$.status").toString();
			if ("DONE".equals(status) || "FAILED".equals(status)) {
				return result;
			}
			Thread.sleep(100L);
		}
		return result;
	}
}
