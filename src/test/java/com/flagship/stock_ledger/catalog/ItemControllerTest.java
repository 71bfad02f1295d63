package com.flagship.stock_ledger.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stock_ledger.ledger.StockTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Catalog API end to end: derived stock on the listing, and rename/delete
 * cascades keeping the name link between items and ledger rows valid.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class ItemControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_stock_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private StockTransactionRepository transactionRepository;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        transactionRepository.deleteAll();
        itemRepository.deleteAll();
    }

    private String createItem(String name, String factor) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("unit", "kg");
        body.put("altUnit", "box");
        body.put("factor", factor);
        body.put("alertQty", 5);

        String response = mockMvc.perform(post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();

        return objectMapper.readTree(response).get("id").asText();
    }

    private void recordTransaction(String itemName, String type, Object quantity, Object altQty) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("date", "2024-05-01");
        body.put("type", type);
        body.put("itemName", itemName);
        body.put("quantity", quantity);
        if (altQty != null) {
            body.put("altQty", altQty);
        }

        mockMvc.perform(post("/api/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated());
    }

    private JsonNode listItems() throws Exception {
        String response = mockMvc.perform(get("/api/items"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(response);
    }

    private JsonNode findByName(JsonNode items, String name) {
        for (JsonNode item : items) {
            if (name.equals(item.get("name").asText())) {
                return item;
            }
        }
        fail("Item not in listing: " + name);
        return null;
    }

    @Test
    @DisplayName("New item is reported with zero stock and defaulted fields")
    void testCreateItem() throws Exception {
        printTestHeader("Create Item");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Rice");
        body.put("unit", "kg");
        body.put("alertQty", 10);

        mockMvc.perform(post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.name").value("Rice"))
            .andExpect(jsonPath("$.altUnit").value("-"))
            .andExpect(jsonPath("$.factor").value("Manual"))
            .andExpect(jsonPath("$.quantity").value(0))
            .andExpect(jsonPath("$.altQuantity").value(0));

        printSuccess("Item created with zero stock");
    }

    @Test
    @DisplayName("Missing required fields are rejected with field details")
    void testCreateItemValidation() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("unit", "kg");

        mockMvc.perform(post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.name").exists())
            .andExpect(jsonPath("$.details.alertQty").exists());

        assertEquals(0, itemRepository.count(), "Nothing may be written on validation failure");
    }

    @Test
    @DisplayName("Factor-derived alternate quantity: Oil factor 5, IN 10 / OUT 4 gives 6 and 30")
    void testFactorDerivedAltQuantity() throws Exception {
        printTestHeader("Oil with factor 5");

        createItem("Oil", "5");
        recordTransaction("Oil", "IN", 10, null);
        recordTransaction("Oil", "OUT", 4, null);

        JsonNode oil = findByName(listItems(), "Oil");
        printOutput("Oil", oil);

        assertEquals(0, oil.get("quantity").decimalValue().compareTo(new java.math.BigDecimal("6")));
        assertEquals(0, oil.get("altQuantity").decimalValue().compareTo(new java.math.BigDecimal("30")));
        printSuccess("Write-time fill made the summed history match the factor");
    }

    @Test
    @DisplayName("Recorded alternate figures win: IN 100 / OUT 20 gives 80 despite factor 5")
    void testSummedHistoryAltQuantity() throws Exception {
        createItem("Oil", "5");
        recordTransaction("Oil", "IN", 10, 100);
        recordTransaction("Oil", "OUT", 4, "20");

        JsonNode oil = findByName(listItems(), "Oil");

        assertEquals(6, oil.get("quantity").asInt());
        assertEquals(80, oil.get("altQuantity").asInt());
    }

    @Test
    @DisplayName("Manual factor without recorded figures reports zero alternate stock")
    void testManualFactorAltQuantity() throws Exception {
        createItem("Cement", "Manual");
        recordTransaction("Cement", "IN", 10, null);

        JsonNode cement = findByName(listItems(), "Cement");

        assertEquals(10, cement.get("quantity").asInt());
        assertEquals(0, cement.get("altQuantity").asInt());
    }

    @Test
    @DisplayName("Matching is case/whitespace-insensitive but never substring")
    void testNameMatching() throws Exception {
        printTestHeader("Rice vs Basmati Rice");

        createItem("Rice", "Manual");
        recordTransaction(" rice ", "IN", 5, null);
        recordTransaction("RICE", "out", 1, null);
        recordTransaction("Basmati Rice", "IN", 7, null);

        JsonNode rice = findByName(listItems(), "Rice");
        printOutput("Rice", rice);

        assertEquals(4, rice.get("quantity").asInt(), "Basmati Rice must not be counted as Rice");
        printSuccess("Only whole-name matches contribute");
    }

    @Test
    @DisplayName("Rename Salt -> Sea Salt moves every Salt row and keeps the stock")
    void testRenameCascade() throws Exception {
        printTestHeader("Rename Cascade");

        String id = createItem("Salt", "Manual");
        recordTransaction("Salt", "IN", 10, null);
        recordTransaction("Salt", "OUT", 3, null);
        int before = findByName(listItems(), "Salt").get("quantity").asInt();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Sea Salt");
        body.put("unit", "kg");
        body.put("alertQty", 5);

        mockMvc.perform(put("/api/items/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("Sea Salt"))
            .andExpect(jsonPath("$.quantity").value(7));

        assertEquals(0, transactionRepository.countByItemName("Salt"));
        assertEquals(2, transactionRepository.countByItemName("Sea Salt"));
        assertEquals(before, findByName(listItems(), "Sea Salt").get("quantity").asInt());

        mockMvc.perform(get("/api/transactions"))
            .andExpect(jsonPath("$[?(@.itemName == 'Salt')]").isEmpty());

        printSuccess("Ledger followed the rename");
    }

    @Test
    @DisplayName("Cascade retry completes a rename and is idempotent")
    void testCascadeRetry() throws Exception {
        String id = createItem("Sea Salt", "Manual");
        // Rows left behind under the old name by an interrupted rename
        recordTransaction("Salt", "IN", 4, null);

        mockMvc.perform(post("/api/items/{id}/cascade", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"previousName\":\"Salt\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rewritten").value(1));

        mockMvc.perform(post("/api/items/{id}/cascade", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"previousName\":\"Salt\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rewritten").value(0));

        assertEquals(4, findByName(listItems(), "Sea Salt").get("quantity").asInt());
    }

    @Test
    @DisplayName("Delete Sugar removes every Sugar row and nothing else")
    void testDeleteCascade() throws Exception {
        printTestHeader("Delete Cascade");

        String id = createItem("Sugar", "Manual");
        createItem("Flour", "Manual");
        recordTransaction("Sugar", "IN", 10, null);
        recordTransaction("Sugar", "OUT", 2, null);
        recordTransaction("Flour", "IN", 3, null);

        mockMvc.perform(delete("/api/items/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Deleted"));

        mockMvc.perform(get("/api/transactions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.itemName == 'Sugar')]").isEmpty())
            .andExpect(jsonPath("$.length()").value(1));

        JsonNode items = listItems();
        assertEquals(1, items.size());
        assertEquals("Flour", items.get(0).get("name").asText());
        printSuccess("Ledger rows of the deleted item are gone");
    }

    @Test
    @DisplayName("Unknown ids return 404")
    void testUnknownItem() throws Exception {
        UUID unknown = UUID.randomUUID();

        mockMvc.perform(delete("/api/items/{id}", unknown))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));

        mockMvc.perform(put("/api/items/{id}", unknown)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"X\",\"unit\":\"kg\",\"alertQty\":1}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Orphaned rows are kept but count towards no item")
    void testOrphanedTransactions() throws Exception {
        createItem("Rice", "Manual");
        recordTransaction("Ghost", "IN", 99, null);

        JsonNode rice = findByName(listItems(), "Rice");
        assertEquals(0, rice.get("quantity").asInt());

        mockMvc.perform(get("/api/transactions"))
            .andExpect(jsonPath("$[0].itemName").value("Ghost"));
    }

    @Test
    @DisplayName("Items sharing a name both see the same rows")
    void testDuplicateNames() throws Exception {
        createItem("Flour", "Manual");
        createItem(" flour ", "Manual");
        recordTransaction("FLOUR", "IN", 6, null);

        JsonNode items = listItems();
        assertEquals(2, items.size());
        assertEquals(6, items.get(0).get("quantity").asInt());
        assertEquals(6, items.get(1).get("quantity").asInt());
    }

    @Test
    @DisplayName("Listing twice without writes yields identical results in catalog order")
    void testListingIsIdempotent() throws Exception {
        createItem("Rice", "Manual");
        createItem("Oil", "5");
        createItem("Salt", "-");
        recordTransaction("Oil", "IN", 2, null);
        recordTransaction("Rice", "IN", 8, "1 bag");

        String first = mockMvc.perform(get("/api/items")).andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(get("/api/items")).andReturn().getResponse().getContentAsString();

        assertEquals(first, second);
        JsonNode items = objectMapper.readTree(first);
        assertEquals("Rice", items.get(0).get("name").asText());
        assertEquals("Oil", items.get(1).get("name").asText());
        assertEquals("Salt", items.get(2).get("name").asText());
    }

    @Test
    @DisplayName("Out-of-range factor and over-precise alert quantity are rejected")
    void testItemNumericBounds() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Oil");
        body.put("unit", "L");
        body.put("factor", "1e999999999");
        body.put("alertQty", new java.math.BigDecimal("0.00001"));

        mockMvc.perform(post("/api/items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.factorInRange").exists())
            .andExpect(jsonPath("$.details.alertQty").exists());

        assertEquals(0, itemRepository.count());
    }
}
