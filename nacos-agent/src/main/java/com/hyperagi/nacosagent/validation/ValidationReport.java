package com.hyperagi.nacosagent.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 环境校验报告
 */
public class ValidationReport {

    public enum Level {
        OK,
        INFO,
        ERROR
    }

    /**
     * 单项校验结果
     *
     * @param key     配置项（环境变量名）
     * @param level   结果级别
     * @param message 说明，不包含密码明文
     */
    public record Entry(String key, Level level, String message) {

        @Override
        public String toString() {
            return key + ": " + message;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public void ok(String key, String message) {
        entries.add(new Entry(key, Level.OK, message));
    }

    public void info(String key, String message) {
        entries.add(new Entry(key, Level.INFO, message));
    }

    public void error(String key, String message) {
        entries.add(new Entry(key, Level.ERROR, message));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Entry> getErrors() {
        return entries.stream()
                .filter(entry -> entry.level() == Level.ERROR)
                .collect(Collectors.toList());
    }

    public boolean isValid() {
        return getErrors().isEmpty();
    }

    /**
     * 查找某一项的结果（同一 key 只记录一次）
     */
    public Entry find(String key) {
        return entries.stream()
                .filter(entry -> entry.key().equals(key))
                .findFirst()
                .orElse(null);
    }
}
