package org.smtlib.encoding;

import org.smtlib.core.FunctionSort;
import org.smtlib.core.Sort;
import org.smtlib.core.SortKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 维护已声明符号表，并生成 declare-fun 命令。
 * 同名符号在一个会话中最多声明一次，重复声明不产生任何输出。
 */
public final class DeclarationManager {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationManager.class);

    private final ScopeStack scopes;
    private final SortEncoder sortEncoder;
    private final Map<String, Sort> variables = new HashMap<>();

    public DeclarationManager(ScopeStack scopes, SortEncoder sortEncoder) {
        this.scopes = Objects.requireNonNull(scopes, "ScopeStack cannot be null.");
        this.sortEncoder = Objects.requireNonNull(sortEncoder, "SortEncoder cannot be null.");
    }

    public void reset() {
        variables.clear();
    }

    public Map<String, Sort> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public boolean isDeclared(String name) {
        return variables.containsKey(name);
    }

    /**
     * 声明一个变量（零元函数）。函数 Sort 的符号转交 {@link #declareFunction}。
     * @param name 符号名，输出时加竖线引号。
     * @param sort 符号的 Sort。
     */
    public void declareVariable(String name, Sort sort) {
        Objects.requireNonNull(name, "Name cannot be null.");
        Objects.requireNonNull(sort, "Sort cannot be null.");
        if (sort.getKind() == SortKind.FUNCTION) {
            declareFunction(name, sort);
        } else if (!alreadyDeclared(name, sort)) {
            variables.put(name, sort);
            scopes.write("(declare-fun |" + name + "| () " + sortEncoder.toSmtLibSort(sort) + ')');
        }
    }

    /**
     * 声明一个函数符号。
     * @param name 符号名。
     * @param sort 必须是 {@link FunctionSort}。
     */
    public void declareFunction(String name, Sort sort) {
        Objects.requireNonNull(name, "Name cannot be null.");
        if (!(sort instanceof FunctionSort functionSort)) {
            logger.error("DeclarationManager.declareFunction: {} 的 Sort 不是函数 Sort: {}", name, sort);
            throw new IllegalArgumentException("declareFunction 需要函数 Sort，实际为: " + sort);
        }
        // TODO 以 (name, domain, codomain) 作为键，支持重载
        if (!alreadyDeclared(name, sort)) {
            String domain = sortEncoder.toSmtLibSort(functionSort.getDomain());
            String codomain = sortEncoder.toSmtLibSort(functionSort.getCodomain());
            variables.put(name, sort);
            scopes.write("(declare-fun |" + name + "| " + domain + " " + codomain + ")");
        }
    }

    private boolean alreadyDeclared(String name, Sort sort) {
        Sort existing = variables.get(name);
        if (existing == null) {
            return false;
        }
        if (!existing.equals(sort)) {
            logger.warn("符号 {} 已以 Sort {} 声明，忽略以 Sort {} 重复声明的请求。", name, existing, sort);
        }
        return true;
    }
}
