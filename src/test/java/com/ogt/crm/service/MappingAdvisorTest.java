package com.ogt.crm.service;

import com.ogt.crm.model.ColumnDataType;
import com.ogt.crm.model.ColumnProfile;
import com.ogt.crm.model.ConfidenceTier;
import com.ogt.crm.model.MappingSuggestion;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.TargetEntity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MappingAdvisorTest {

    private final MappingAdvisor advisor = new MappingAdvisor(new TargetFieldCatalog());

    @Test
    void sameKeywordMatchesIndependentlyPerSheet() {
        List<MappingSuggestion> organizations = advisor.suggest(analysis("Organizations", "Company Email"),
                TargetEntity.ORGANIZATIONS);
        List<MappingSuggestion> contacts = advisor.suggest(analysis("Contacts", "Contact Email"),
                TargetEntity.CONTACTS);

        assertThat(find(organizations, "email").getSourceColumn()).isEqualTo("Company Email");
        assertThat(find(contacts, "email").getSourceColumn()).isEqualTo("Contact Email");
    }

    @Test
    void onlyOneSuggestionSurvivesPerTargetField() {
        List<MappingSuggestion> suggestions = advisor.suggest(
                analysis("Contacts", "Company Email", "Contact Email"), TargetEntity.CONTACTS);

        assertThat(suggestions).extracting(MappingSuggestion::getTargetField).doesNotHaveDuplicates();
        assertThat(suggestions.stream().filter(s -> s.getTargetField().equals("email")))
                .singleElement()
                .satisfies(s -> {
                    assertThat(s.getSourceColumn()).isEqualTo("Company Email");
                    assertThat(s.getConfidence()).isEqualTo(ConfidenceTier.MEDIUM);
                });
    }

    @Test
    void highConfidenceSupersedesEarlierMedium() {
        List<MappingSuggestion> suggestions = advisor.suggest(
                analysis("Organizations", "Email Address", "Email"), TargetEntity.ORGANIZATIONS);

        MappingSuggestion email = find(suggestions, "email");
        assertThat(email.getSourceColumn()).isEqualTo("Email");
        assertThat(email.getColumnIndex()).isEqualTo(1);
        assertThat(email.getConfidence()).isEqualTo(ConfidenceTier.HIGH);
        assertThat(email.getReason()).isEqualTo("Exact match");
    }

    @Test
    void containedKeywordOnPriorityOneFieldIsHigh() {
        List<MappingSuggestion> suggestions = advisor.suggest(
                analysis("Organizations", "Company Email"), TargetEntity.ORGANIZATIONS);

        MappingSuggestion name = find(suggestions, "name");
        assertThat(name.getConfidence()).isEqualTo(ConfidenceTier.HIGH);
        assertThat(name.getReason()).isEqualTo("Contains keyword");
        assertThat(find(suggestions, "email").getConfidence()).isEqualTo(ConfidenceTier.MEDIUM);
    }

    @Test
    void suggestionsAreSortedHighFirst() {
        List<MappingSuggestion> suggestions = advisor.suggest(
                analysis("Organizations", "Town Name", "Organization"), TargetEntity.ORGANIZATIONS);

        assertThat(suggestions).extracting(MappingSuggestion::getTargetField).containsExactly("name", "city");
        assertThat(suggestions).extracting(MappingSuggestion::getConfidence)
                .containsExactly(ConfidenceTier.HIGH, ConfidenceTier.MEDIUM);
    }

    @Test
    void symbolOnlyHeadersNeverMatch() {
        assertThat(advisor.suggest(analysis("Contacts", "###", "--"), TargetEntity.CONTACTS)).isEmpty();
    }

    @Test
    void skippedSheetHasNoSuggestions() {
        assertThat(advisor.suggest(SheetAnalysis.skipped("Contacts", "Empty sheet"), TargetEntity.CONTACTS)).isEmpty();
    }

    private static SheetAnalysis analysis(String name, String... headers) {
        List<ColumnProfile> profiles = new ArrayList<>();
        for (int i = 0; i < headers.length; i++) {
            profiles.add(ColumnProfile.builder()
                    .index(i)
                    .header(headers[i])
                    .dataType(ColumnDataType.STRING)
                    .sampleValues(List.of("x"))
                    .nonEmptyCount(1)
                    .build());
        }
        return SheetAnalysis.builder()
                .name(name)
                .headerRowIndex(0)
                .dataStartRow(1)
                .totalRows(2)
                .headers(List.of(headers))
                .columnProfiles(profiles)
                .build();
    }

    private static MappingSuggestion find(List<MappingSuggestion> suggestions, String field) {
        return suggestions.stream()
                .filter(s -> s.getTargetField().equals(field))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No suggestion for " + field));
    }
}
