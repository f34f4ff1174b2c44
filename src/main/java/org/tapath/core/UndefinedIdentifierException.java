package org.tapath.core;

import lombok.Getter;

/**
 * 在 Context 中查找一个未声明的标识符时抛出。
 * @author Ayalyt
 */
@Getter
public class UndefinedIdentifierException extends IllegalArgumentException {

    private final String identifier;

    public UndefinedIdentifierException(String identifier) {
        super("未定义的标识符: '" + identifier + "'");
        this.identifier = identifier;
    }
}
