package com.ogt.crm.service;

import com.ogt.crm.model.FieldType;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.TargetField;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ogt.crm.model.TargetField.of;
import static com.ogt.crm.model.TargetField.required;

/**
 * Tabla estática de campos destino por entidad: palabras clave para sugerir el mapeo,
 * prioridad (1 = más fuerte), obligatoriedad y tipo de normalización.
 * El orden de cada lista es el orden en que se prueban las palabras clave.
 */
@Component
public class TargetFieldCatalog {

    private static final Map<TargetEntity, List<TargetField>> FIELDS = new EnumMap<>(TargetEntity.class);

    static {
        FIELDS.put(TargetEntity.ORGANIZATIONS, List.of(
                required("name", FieldType.TEXT, 1, "organization", "company", "business", "customer", "client"),
                of("priority", FieldType.PRIORITY, 1, "priority", "tier", "level", "importance"),
                of("segment", FieldType.TEXT, 1, "segment", "category", "type", "industry"),
                of("distributor", FieldType.TEXT, 2, "distributor", "supplier", "vendor"),
                of("accountManager", FieldType.TEXT, 2, "manager", "account", "rep", "owner"),
                of("phone", FieldType.PHONE, 2, "phone", "telephone", "tel", "mobile"),
                of("email", FieldType.EMAIL, 2, "email", "e-mail", "mail"),
                of("address", FieldType.TEXT, 2, "address", "street", "location"),
                of("city", FieldType.TEXT, 3, "city", "town"),
                of("state", FieldType.UPPER_TEXT, 3, "state", "province"),
                of("zipCode", FieldType.ZIP, 3, "zip", "postal", "postcode"),
                of("notes", FieldType.TEXT, 3, "notes", "comments", "remarks")
        ));

        FIELDS.put(TargetEntity.CONTACTS, List.of(
                of("fullName", FieldType.TEXT, 1, "name", "full", "contact"),
                of("firstName", FieldType.TEXT, 1, "first", "fname", "given"),
                of("lastName", FieldType.TEXT, 1, "last", "lname", "surname"),
                required("organizationName", FieldType.TEXT, 1, "organization", "company", "business"),
                of("position", FieldType.TEXT, 2, "position", "title", "role", "job"),
                of("email", FieldType.EMAIL, 2, "email", "e-mail"),
                of("phone", FieldType.PHONE, 2, "phone", "mobile", "tel"),
                of("accountManager", FieldType.TEXT, 3, "manager", "account", "owner"),
                of("linkedIn", FieldType.TEXT, 3, "linkedin", "social")
        ));

        FIELDS.put(TargetEntity.OPPORTUNITIES, List.of(
                required("organizationName", FieldType.TEXT, 1, "organization", "company", "customer"),
                required("name", FieldType.TEXT, 1, "opportunity", "deal", "name"),
                of("stage", FieldType.STAGE, 1, "stage", "phase", "step"),
                of("status", FieldType.OPPORTUNITY_STATUS, 1, "status", "state"),
                of("value", FieldType.NUMBER, 2, "value", "amount", "revenue", "volume"),
                of("probability", FieldType.PERCENT, 2, "probability", "chance", "likelihood"),
                of("startDate", FieldType.DATE, 2, "start", "begin", "created"),
                of("expectedCloseDate", FieldType.DATE, 2, "close", "end", "expected", "target"),
                of("principal", FieldType.TEXT, 3, "principal", "brand"),
                of("product", FieldType.TEXT, 3, "product", "item", "sku"),
                of("owner", FieldType.TEXT, 3, "owner", "rep", "manager")
        ));

        FIELDS.put(TargetEntity.INTERACTIONS, List.of(
                required("date", FieldType.DATE, 1, "date", "when", "time"),
                of("type", FieldType.INTERACTION_TYPE, 1, "interaction", "type", "activity", "action"),
                of("organizationName", FieldType.TEXT, 1, "organization", "company", "account"),
                of("contactName", FieldType.TEXT, 2, "contact", "person", "who"),
                of("accountManager", FieldType.TEXT, 2, "manager", "account", "rep"),
                of("opportunity", FieldType.TEXT, 3, "opportunity", "deal"),
                of("principal", FieldType.TEXT, 3, "principal", "brand"),
                of("notes", FieldType.TEXT, 3, "notes", "description", "details")
        ));
    }

    public List<TargetField> fieldsFor(TargetEntity entity) {
        return FIELDS.getOrDefault(entity, List.of());
    }

    public Optional<TargetField> field(TargetEntity entity, String name) {
        return fieldsFor(entity).stream().filter(f -> f.getName().equals(name)).findFirst();
    }
}
