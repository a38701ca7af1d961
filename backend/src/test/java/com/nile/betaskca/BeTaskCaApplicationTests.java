package com.nile.betaskca;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application context on the in-memory repositories: register a user,
 * stock the catalog and fill the cart over HTTP.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class BeTaskCaApplicationTests {

	@Autowired
	MockMvc mvc;

	@Autowired
	ObjectMapper objectMapper;

	@Test
	void rootGreets() throws Exception {
		mvc.perform(get("/"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.message").value("Thanks for shopping at Nile!"));
	}

	@Test
	void shoppingFlow() throws Exception {
		String userId = idOf(mvc.perform(post("/users/").contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"first_name":"Ada","last_name":"Lovelace","email":"ada@example.com",
								 "password":"engine","shipping_address":null}
								"""))
				.andExpect(status().isOk())
				.andReturn().getResponse().getContentAsString());

		String itemId = idOf(mvc.perform(post("/items/").contentType(MediaType.APPLICATION_JSON)
						.content("{\"name\":\"Difference Engine\",\"price\":99.90,\"quantity\":3}"))
				.andExpect(status().isOk())
				.andReturn().getResponse().getContentAsString());

		mvc.perform(get("/items/"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.items[?(@.name == 'Difference Engine')]").exists());

		// more than in stock
		mvc.perform(post("/users/{id}/cart", userId).contentType(MediaType.APPLICATION_JSON)
						.content("{\"item_id\":\"" + itemId + "\",\"quantity\":4}"))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.message").value("Not enough items in stock"));

		mvc.perform(post("/users/{id}/cart", userId).contentType(MediaType.APPLICATION_JSON)
						.content("{\"item_id\":\"" + itemId + "\",\"quantity\":3}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.items[0].item_id").value(itemId))
				.andExpect(jsonPath("$.items[0].quantity").value(3));

		mvc.perform(post("/users/{id}/cart", userId).contentType(MediaType.APPLICATION_JSON)
						.content("{\"item_id\":\"" + itemId + "\",\"quantity\":1}"))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.message").value("Item already in cart"));

		mvc.perform(get("/users/{id}/cart", userId))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.items.length()").value(1));
	}

	@Test
	void duplicateEmailIsRejected() throws Exception {
		String body = """
				{"first_name":"Grace","last_name":"Hopper","email":"grace@example.com","password":"cobol"}
				""";
		mvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON).content(body))
				.andExpect(status().isOk());
		mvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON).content(body))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.message").value("An user with this email already exists"));
	}

	@Test
	void createdItemShowsUpInCachedListing() throws Exception {
		mvc.perform(get("/items"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.items[?(@.name == 'Analytical Engine')]").doesNotExist());

		mvc.perform(post("/items").contentType(MediaType.APPLICATION_JSON)
						.content("{\"name\":\"Analytical Engine\",\"price\":12.5,\"quantity\":1}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.price").value(12.5));

		mvc.perform(get("/items"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.items[?(@.name == 'Analytical Engine')]").exists());
	}

	@Test
	void unknownRouteIsNotFound() throws Exception {
		mvc.perform(get("/nope"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.status").value(404))
				.andExpect(jsonPath("$.message").value("Not found"));
	}

	@Test
	void unsupportedMethodIsNotAllowed() throws Exception {
		mvc.perform(delete("/items"))
				.andExpect(status().isMethodNotAllowed())
				.andExpect(jsonPath("$.status").value(405));
	}

	@Test
	void validationDetailsUseWireFieldNames() throws Exception {
		mvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON)
						.content("{\"email\":\"ada@example.com\",\"password\":\"engine\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.details.first_name").value("First name is required"))
				.andExpect(jsonPath("$.details.last_name").value("Last name is required"));
	}

	@Test
	void cartOfUnknownUserIsEmpty() throws Exception {
		mvc.perform(get("/users/{id}/cart", java.util.UUID.randomUUID()))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.items").isEmpty());
	}

	private String idOf(String json) throws Exception {
		JsonNode node = objectMapper.readTree(json);
		assertThat(node.hasNonNull("id")).isTrue();
		return node.get("id").asText();
	}

}
