package com.supermart.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Random;

/**
 * Utility class to generate sample SuperMart input files for testing the pipeline.
 * The transactions carry the data quality issues the pipeline is designed to handle:
 * repeated order ids, mixed date layouts, impossible dates, missing customers and
 * product/store ids absent from the catalogs.
 */
public class SampleDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(SampleDataGenerator.class);

    static final String UNKNOWN_PRODUCT = "P999";
    static final String UNKNOWN_STORE = "T99";

    private static final String[][] PRODUCTS = {
        {"P001", "Leche entera 1L", "Lácteos", "Alpina"},
        {"P002", "Queso campesino", "Lácteos", "Colanta"},
        {"P003", "Yogur fresa", "Lácteos", "Alpina"},
        {"P004", "Gaseosa 1.5L", "Bebidas", "Postobón"},
        {"P005", "Agua sin gas", "Bebidas", "Cristal"},
        {"P006", "Café molido 500g", "Bebidas", "Sello Rojo"},
        {"P007", "Jabón en barra", "Aseo", "Rey"},
        {"P008", "Detergente 1kg", "Aseo", "Fab"},
        {"P009", "Papel higiénico x12", "Aseo", "Familia"},
        {"P010", "Pan tajado", "Panadería", "Bimbo"},
        {"P011", "Arepas x10", "Panadería", "Doña Paisa"},
        {"P012", "Banano kg", "Frutas y Verduras", "Granel"},
        {"P013", "Tomate kg", "Frutas y Verduras", "Granel"},
        {"P014", "Pechuga de pollo kg", "Carnes", "Mac Pollo"},
        {"P015", "Carne molida kg", "Carnes", "Zenú"},
        {"P016", "Papas fritas", "Snacks", "Margarita"},
        {"P017", "Chocolatina", "Snacks", "Jet"}
    };

    private static final String[][] STORES = {
        {"T01", "SuperMart Centro", "Bogotá", "Andina"},
        {"T02", "SuperMart Norte", "Bogotá", "Andina"},
        {"T03", "SuperMart El Poblado", "Medellín", "Andina"},
        {"T04", "SuperMart Granada", "Cali", "Pacífica"},
        {"T05", "SuperMart Prado", "Barranquilla", "Caribe"},
        {"T06", "SuperMart Bocagrande", "Cartagena", "Caribe"},
        {"T07", "SuperMart Cabecera", "Bucaramanga", "Andina"}
    };

    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    private static final String[] INVALID_DATES = {"2024-13-45", "31/02/2024", "sin fecha", "2024-02-30"};

    private final Random random;

    public SampleDataGenerator(long seed) {
        this.random = new Random(seed);
    }

    public static void main(String[] args) {
        int numRecords = args.length > 0 ? Integer.parseInt(args[0]) : 5000;
        String outputDir = args.length > 1 ? args[1] : PipelineConfig.DEFAULT_INPUT_DIR;

        log.info("Generating {} sample transactions...", numRecords);
        try {
            new SampleDataGenerator(42).generate(numRecords, Paths.get(outputDir));
            log.info("Sample data generated in: {}", outputDir);
        } catch (IOException e) {
            log.error("Error generating sample data: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Writes ventas_crudas.csv, productos.csv and tiendas.csv into {@code directory}.
     */
    public void generate(int numRecords, Path directory) throws IOException {
        Files.createDirectories(directory);
        writeProducts(directory.resolve(PipelineConfig.PRODUCTS_FILE));
        writeStores(directory.resolve(PipelineConfig.STORES_FILE));
        writeTransactions(numRecords, directory.resolve(PipelineConfig.TRANSACTIONS_FILE));
    }

    void writeProducts(Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.append("producto_id,nombre_producto,categoria,marca\n");
            for (String[] product : PRODUCTS) {
                writer.append(String.join(",", product)).append('\n');
            }
        }
    }

    void writeStores(Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.append("tienda_id,nombre_tienda,ciudad,region\n");
            for (String[] store : STORES) {
                writer.append(String.join(",", store)).append('\n');
            }
        }
    }

    void writeTransactions(int numRecords, Path file) throws IOException {
        LocalDate day = LocalDate.of(2024, 1, 1);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.append("order_id,producto_id,cantidad,precio_unitario,cliente_id,tienda_id,fecha\n");

            for (int i = 1; i <= numRecords; i++) {
                // 5% chance of repeating an earlier order id
                int orderId = 1000 + i;
                if (random.nextDouble() < 0.05 && i > 10) {
                    orderId = 1000 + random.nextInt(i - 1) + 1;
                }

                String productId = random.nextDouble() < 0.02
                    ? UNKNOWN_PRODUCT
                    : PRODUCTS[random.nextInt(PRODUCTS.length)][0];
                String storeId = random.nextDouble() < 0.02
                    ? UNKNOWN_STORE
                    : STORES[random.nextInt(STORES.length)][0];

                int quantity = random.nextDouble() < 0.02 ? 0 : random.nextInt(10) + 1;
                String unitPrice = String.format(Locale.ROOT, "%.2f", 1.5 + random.nextDouble() * 48.5);
                String customerId = random.nextDouble() < 0.05 ? "" : "C" + (100 + random.nextInt(400));

                String date;
                if (random.nextDouble() < 0.03) {
                    date = INVALID_DATES[random.nextInt(INVALID_DATES.length)];
                } else {
                    day = day.plusDays(random.nextInt(2));
                    if (day.getYear() > 2024) {
                        day = LocalDate.of(2024, random.nextInt(12) + 1, random.nextInt(28) + 1);
                    }
                    date = random.nextBoolean() ? day.format(ISO) : day.format(DAY_FIRST);
                }

                writer.append(String.join(",",
                    String.valueOf(orderId),
                    productId,
                    String.valueOf(quantity),
                    unitPrice,
                    customerId,
                    storeId,
                    date
                ));
                writer.append('\n');
            }
        }
    }
}
