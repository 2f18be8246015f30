package com.taxstudio.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Counterparty used as a matching signal. {@code userId} is null for global partners shared by all users.
 */
@Document(collection = "partners")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Partner {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String userId;
    private String name;
    private List<String> aliases = new ArrayList<>();
    private List<String> ibans = new ArrayList<>();
    private String vatId;
    private List<String> emailDomains = new ArrayList<>();
    private String website;

    public boolean isGlobal() {
        return userId == null;
    }

    /** Visible to the user when global or owned by them. */
    public boolean isVisibleTo(String requestingUserId) {
        return isGlobal() || userId.equals(requestingUserId);
    }
}
