package com.scandrift.core.catalog;

import com.scandrift.core.client.InMemoryScanToolApi;
import com.scandrift.core.config.DriftConfigurationException;
import com.scandrift.core.model.Organization;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrganizationResolverTest {

    @Test
    void resolve_orgId_returnsOnlyThatOrganization() {
        InMemoryScanToolApi api = new InMemoryScanToolApi().organization(new Organization("other", null, null));

        List<String> ids = new OrganizationResolver(api).resolve(null, " org-7 ");

        assertThat(ids).containsExactly("org-7");
    }

    @Test
    void resolve_groupId_listsGroupOrganizationsWithoutDuplicates() {
        InMemoryScanToolApi api = new InMemoryScanToolApi()
            .groupOrganization("g1", new Organization("org-1", "One", "one"))
            .groupOrganization("g1", new Organization("org-2", "Two", "two"))
            .groupOrganization("g1", new Organization("org-1", "One", "one"));

        List<String> ids = new OrganizationResolver(api).resolve("g1", null);

        assertThat(ids).containsExactly("org-1", "org-2");
    }

    @Test
    void resolve_neither_listsAllAccessibleOrganizations() {
        InMemoryScanToolApi api = new InMemoryScanToolApi()
            .organization(new Organization("org-1", "One", "one"))
            .organization(new Organization("org-2", "Two", "two"));

        assertThat(new OrganizationResolver(api).resolve("", "  ")).containsExactly("org-1", "org-2");
    }

    @Test
    void resolve_bothIds_throwsConfigurationException() {
        OrganizationResolver resolver = new OrganizationResolver(new InMemoryScanToolApi());

        assertThatThrownBy(() -> resolver.resolve("g1", "org-1"))
            .isInstanceOf(DriftConfigurationException.class)
            .hasMessageContaining("not both");
    }

    @Test
    void resolve_unknownGroup_throwsConfigurationException() {
        OrganizationResolver resolver = new OrganizationResolver(new InMemoryScanToolApi());

        assertThatThrownBy(() -> resolver.resolve("missing", null))
            .isInstanceOf(DriftConfigurationException.class)
            .hasMessage("No organizations found for group missing");
    }

    @Test
    void resolve_noAccessibleOrganizations_throwsConfigurationException() {
        OrganizationResolver resolver = new OrganizationResolver(new InMemoryScanToolApi());

        assertThatThrownBy(() -> resolver.resolve(null, null))
            .isInstanceOf(DriftConfigurationException.class)
            .hasMessageContaining("No organizations accessible");
    }
}
