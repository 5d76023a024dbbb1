package com.bank.lending.application.config;

import com.bank.lending.domain.enums.DocumentType;
import com.bank.lending.domain.enums.VerifiableField;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Product policy that may vary per tenant
 *
 * Configuration in application.yml:
 *   app:
 *     lending:
 *       references: { min-to-submit: 2, max: 3 }
 *       name-group-label: "Nombre Completo"
 *       collapse-name-fields: true
 *       default-required-documents: [INE_FRONT, INE_BACK, PROOF_ADDRESS, PROOF_INCOME]
 *       products:
 *         PERSONAL:
 *           required-documents: [...]
 */
@Data
@ConfigurationProperties(prefix = "app.lending")
public class LendingProperties {

    private References references = new References();

    /**
     * Label shown for the name sub-fields when they are reported as one section
     */
    private String nameGroupLabel = "Nombre Completo";

    private boolean collapseNameFields = true;

    private List<DocumentType> defaultRequiredDocuments = new ArrayList<>(List.of(
            DocumentType.INE_FRONT,
            DocumentType.INE_BACK,
            DocumentType.PROOF_ADDRESS,
            DocumentType.PROOF_INCOME));

    private Map<String, Product> products = new LinkedHashMap<>();

    /**
     * Required documents of a product, falling back to the default list
     */
    public List<DocumentType> requiredDocumentsFor(String productCode) {
        if (productCode != null) {
            Product product = products.get(productCode);
            if (product != null && product.getRequiredDocuments() != null
                    && !product.getRequiredDocuments().isEmpty()) {
                return product.getRequiredDocuments();
            }
        }
        return defaultRequiredDocuments;
    }

    /**
     * Label of the section a field belongs to. Name sub-fields share one label when collapsing is on.
     */
    public String sectionLabel(VerifiableField field) {
        if (collapseNameFields && field.isNameField()) {
            return nameGroupLabel;
        }
        return field.getLabel();
    }

    @Data
    public static class References {
        private int minToSubmit = 2;
        private int max = 3;
    }

    @Data
    public static class Product {
        private List<DocumentType> requiredDocuments = new ArrayList<>();
    }
}
