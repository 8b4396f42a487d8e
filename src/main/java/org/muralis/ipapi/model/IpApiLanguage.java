package org.muralis.ipapi.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Languages ip-api.com can localize place names into.
 */
@Getter
@RequiredArgsConstructor
public enum IpApiLanguage {

    DE("de"),
    EN("en"),
    ES("es"),
    FR("fr"),
    JA("ja"),
    PT_BR("pt-BR"),
    RU("ru"),
    ZH_CN("zh-CN");

    public static final IpApiLanguage DEFAULT = EN;

    private final String code;

    public boolean isDefault() {
        return this == DEFAULT;
    }
}
