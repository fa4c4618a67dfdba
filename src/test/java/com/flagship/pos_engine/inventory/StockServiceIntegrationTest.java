package com.flagship.pos_engine.inventory;

import com.flagship.pos_engine.pricing.Money;
import com.flagship.pos_engine.support.StockFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stock management against PostgreSQL, including the schema's own guards.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class StockServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pos_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private StockService stockService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final UUID merchantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM transaction_line_items");
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM stock_items");
    }

    @Test
    @DisplayName("Register, restock and reprice round trip through the database")
    void lifecycle() {
        StockItem item = stockService.registerStock(merchantId, StockFixtures.noodles(5));

        stockService.restock(merchantId, item.getId(), 5);
        StockItem repriced = stockService.reprice(merchantId, item.getId(), Money.of(2000), 50);

        StockItem reloaded = stockService.getStockItem(merchantId, item.getId()).orElseThrow();
        assertEquals(10, reloaded.getQuantityOnHand());
        assertEquals(0, new BigDecimal("3000.00").compareTo(reloaded.getSaleUnitPrice()));
        assertEquals(0, new BigDecimal("30000.00").compareTo(reloaded.getPricing().getSaleTotal()));
        assertEquals(repriced.getId(), reloaded.getId());
    }

    @Test
    @DisplayName("Stock listing is per merchant")
    void listing() {
        stockService.registerStock(merchantId, StockFixtures.coffee(1));
        stockService.registerStock(merchantId, StockFixtures.noodles(1));
        stockService.registerStock(UUID.randomUUID(), StockFixtures.noodles(1));

        List<StockItem> items = stockService.listStock(merchantId);

        assertEquals(List.of("Indomie", "Kopi"), items.stream().map(StockItem::getName).toList());
    }

    @Test
    @DisplayName("Restocking another merchant's item reports not found")
    void foreignRestock() {
        StockItem item = stockService.registerStock(merchantId, StockFixtures.noodles(5));

        assertThrows(StockItemNotFoundException.class,
            () -> stockService.restock(UUID.randomUUID(), item.getId(), 1));
    }

    @Test
    @DisplayName("The schema refuses zero-quantity rows")
    void schemaRejectsEmptyRows() {
        Timestamp now = Timestamp.from(Instant.now());

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO stock_items (id, merchant_id, name, quantity_on_hand, unit_size, purchase_unit_price, "
                + "profit_margin_percent, purchase_total, sale_unit_price, sale_total, created_at, updated_at) "
                + "VALUES (?, ?, 'Empty', 0, 1, 1.00, 0, 0.00, 1.00, 0.00, ?, ?)",
            UUID.randomUUID(), merchantId, now, now));
    }
}
