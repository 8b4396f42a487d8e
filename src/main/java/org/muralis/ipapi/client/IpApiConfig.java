package org.muralis.ipapi.client;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.muralis.ipapi.model.IpApiField;
import org.muralis.ipapi.model.IpApiLanguage;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Selects which optional fields a lookup asks for and in which language.
 * Requesting fewer fields shrinks the response.
 *
 * <pre>{@code
 * IpData data = client.makeRequest(
 *         IpApiConfig.empty()
 *                 .include(IpApiField.COUNTRY, IpApiField.CURRENCY)
 *                 .setLanguage(IpApiLanguage.DE),
 *         "1.1.1.1");
 * }</pre>
 *
 * Instances are mutable and not thread-safe. {@link IpApiClient} takes a
 * {@link #copy()} when a request starts.
 */
@ToString
@EqualsAndHashCode
public final class IpApiConfig {

    /**
     * Fields of {@link #minimum()}.
     */
    public static final Set<IpApiField> MINIMUM_FIELDS = Collections.unmodifiableSet(EnumSet.of(
            IpApiField.COUNTRY_CODE,
            IpApiField.CITY,
            IpApiField.TIMEZONE,
            IpApiField.OFFSET,
            IpApiField.CURRENCY,
            IpApiField.ISP));

    private final EnumSet<IpApiField> fields;

    @Getter
    private IpApiLanguage language;

    private IpApiConfig(EnumSet<IpApiField> fields, IpApiLanguage language) {
        this.fields = fields;
        this.language = language;
    }

    /** No optional fields, default language. */
    public static IpApiConfig empty() {
        return new IpApiConfig(EnumSet.noneOf(IpApiField.class), IpApiLanguage.DEFAULT);
    }

    /** The {@link #MINIMUM_FIELDS}, default language. */
    public static IpApiConfig minimum() {
        return new IpApiConfig(EnumSet.copyOf(MINIMUM_FIELDS), IpApiLanguage.DEFAULT);
    }

    /** Every field, default language. */
    public static IpApiConfig maximum() {
        return new IpApiConfig(EnumSet.allOf(IpApiField.class), IpApiLanguage.DEFAULT);
    }

    public IpApiConfig include(IpApiField... toInclude) {
        for (IpApiField field : toInclude) {
            fields.add(Objects.requireNonNull(field, "field"));
        }
        return this;
    }

    public IpApiConfig exclude(IpApiField... toExclude) {
        for (IpApiField field : toExclude) {
            fields.remove(Objects.requireNonNull(field, "field"));
        }
        return this;
    }

    /**
     * @param language the response language, {@code null} restores the default
     */
    public IpApiConfig setLanguage(IpApiLanguage language) {
        this.language = language != null ? language : IpApiLanguage.DEFAULT;
        return this;
    }

    public boolean isIncluded(IpApiField field) {
        return fields.contains(field);
    }

    public Set<IpApiField> getFields() {
        return Collections.unmodifiableSet(EnumSet.copyOf(fields));
    }

    /**
     * Value of the {@code fields} query parameter: the bits of the selected
     * fields plus {@link IpApiField#MESSAGE_BIT}.
     */
    public int fieldsBitmask() {
        int mask = IpApiField.MESSAGE_BIT;
        for (IpApiField field : fields) {
            mask |= field.getBit();
        }
        return mask;
    }

    /**
     * Selected fields as the comma-separated JSON keys, the form ip-api.com also accepts for {@code fields}.
     */
    public String fieldNames() {
        return fields.stream()
                .map(IpApiField::getJsonName)
                .collect(Collectors.joining(","));
    }

    public IpApiConfig copy() {
        return new IpApiConfig(EnumSet.copyOf(fields), language);
    }
}
