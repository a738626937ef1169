package com.pricelens.engine.ingest;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.dto.ImportDtos;
import com.pricelens.engine.error.MissingRequiredFieldException;
import com.pricelens.engine.error.Warn;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.repository.CatalogRepository;
import com.pricelens.engine.util.NumberParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an uploaded CSV into catalog products.
 *
 * <p>Parsing and mapping failures ({@link com.pricelens.engine.error.EmptyInputException},
 * {@link MissingRequiredFieldException}) abort the call before anything is written. Row-level
 * problems only skip the row (or drop an optional value) and are reported as warnings.
 */
@Service
public class CatalogImportService {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final CsvParser csvParser;
    private final ColumnMapper columnMapper;
    private final CatalogRepository catalogRepository;
    private final AppProperties appProperties;

    public CatalogImportService(CsvParser csvParser, ColumnMapper columnMapper,
                                CatalogRepository catalogRepository, AppProperties appProperties) {
        this.csvParser = csvParser;
        this.columnMapper = columnMapper;
        this.catalogRepository = catalogRepository;
        this.appProperties = appProperties;
    }

    /** Products converted from rows plus the warnings collected on the way. */
    public static class ConversionResult {
        public final List<Product> products;
        public final List<Warn> warnings;
        public final int skipped;

        ConversionResult(List<Product> products, List<Warn> warnings, int skipped) {
            this.products = products;
            this.warnings = warnings;
            this.skipped = skipped;
        }
    }

    public ImportDtos.ImportReport importCsv(String storeId, String csvText, Map<CatalogField, String> overrides) {
        CsvTable table = csvParser.parse(csvText);
        ColumnMapping mapping = resolveMapping(table.getHeaders(), overrides);

        ConversionResult result = toProducts(storeId, table, mapping);
        catalogRepository.saveAll(storeId, result.products);

        List<Warn> warnings = new ArrayList<>(table.getWarnings());
        warnings.addAll(result.warnings);
        int malformed = (int) table.getWarnings().stream().filter(w -> "ROW_PARSE".equals(w.getCode())).count();

        ImportDtos.ImportReport report = new ImportDtos.ImportReport();
        report.setStore_id(storeId);
        report.setRows_total(table.getRows().size() + malformed);
        report.setImported(result.products.size());
        report.setSkipped(result.skipped + malformed);
        report.setMapping(mapping.asMap());
        report.setWarnings_total(warnings.size());
        int sample = Math.max(0, appProperties.getRun().getWarningSampleSize());
        report.setWarnings(new ArrayList<>(warnings.subList(0, Math.min(sample, warnings.size()))));

        log.info("CSV import finished: store={} rows={} imported={} skipped={} warnings={}",
                storeId, report.getRows_total(), report.getImported(), report.getSkipped(), warnings.size());
        return report;
    }

    /**
     * Auto-maps the headers, applies manual overrides, and fails when a required field is still
     * unmapped. Overrides naming a header that is not in the file count as unmapped.
     */
    public ColumnMapping resolveMapping(List<String> headers, Map<CatalogField, String> overrides) {
        ColumnMapping mapping = columnMapper.autoMap(headers).withOverrides(overrides);
        Set<String> present = new HashSet<>(headers);
        Map<CatalogField, String> kept = new EnumMap<>(CatalogField.class);
        for (CatalogField f : CatalogField.values()) {
            mapping.get(f).filter(present::contains).ifPresent(h -> kept.put(f, h));
        }
        ColumnMapping effective = new ColumnMapping(kept);
        MappingValidation validation = columnMapper.validate(effective);
        if (!validation.valid()) {
            log.warn("CSV import rejected, unmapped required fields: {}", validation.missing());
            throw new MissingRequiredFieldException(validation.missing());
        }
        return effective;
    }

    public ConversionResult toProducts(String storeId, CsvTable table, ColumnMapping mapping) {
        Map<String, Product> bySku = new LinkedHashMap<>();
        List<Warn> warnings = new ArrayList<>();
        int skipped = 0;

        for (CsvRow row : table.getRows()) {
            Optional<String> name = value(row, mapping, CatalogField.NAME);
            Optional<String> sku = value(row, mapping, CatalogField.SKU);
            Optional<String> priceText = value(row, mapping, CatalogField.PRICE);

            boolean missing = false;
            if (name.isEmpty()) { warnings.add(Warn.missingValue(row.getLine(), "name")); missing = true; }
            if (sku.isEmpty()) { warnings.add(Warn.missingValue(row.getLine(), "sku")); missing = true; }
            if (priceText.isEmpty()) { warnings.add(Warn.missingValue(row.getLine(), "price")); missing = true; }
            if (missing) {
                skipped++;
                continue;
            }

            Double price = NumberParser.parseDecimal(priceText.get());
            if (price == null || price < 0) {
                warnings.add(Warn.badNumber(row.getLine(), "price", priceText.get(), true));
                skipped++;
                continue;
            }

            Double cost = null;
            Optional<String> costText = value(row, mapping, CatalogField.COST);
            if (costText.isPresent()) {
                cost = NumberParser.parseDecimal(costText.get());
                if (cost == null || cost < 0) {
                    warnings.add(Warn.badNumber(row.getLine(), "cost", costText.get(), false));
                    cost = null;
                }
            }

            Integer inventory = null;
            Optional<String> invText = value(row, mapping, CatalogField.INVENTORY);
            if (invText.isPresent()) {
                inventory = NumberParser.parseInteger(invText.get());
                if (inventory == null) {
                    warnings.add(Warn.badNumber(row.getLine(), "inventory", invText.get(), false));
                }
            }

            String currency = value(row, mapping, CatalogField.CURRENCY)
                    .map(c -> c.toUpperCase(Locale.ROOT))
                    .orElse(appProperties.getCatalog().getDefaultCurrency());

            Product product = new Product(storeId + ":" + sku.get(), name.get(), sku.get(), price, currency, cost);
            product.setStoreId(storeId);
            product.setInventory(inventory);
            if (bySku.put(sku.get(), product) != null) {
                warnings.add(Warn.duplicateSku(row.getLine(), sku.get()));
                skipped++;
            }
        }
        return new ConversionResult(new ArrayList<>(bySku.values()), warnings, skipped);
    }

    private static Optional<String> value(CsvRow row, ColumnMapping mapping, CatalogField field) {
        return mapping.get(field).flatMap(row::nonBlank);
    }
}
