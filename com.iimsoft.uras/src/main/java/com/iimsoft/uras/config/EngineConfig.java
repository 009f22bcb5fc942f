package com.iimsoft.uras.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.uras.cp.CpConfig;
import com.iimsoft.uras.dispatching.DispatchingRules;
import com.iimsoft.uras.dispatching.EvaluationMode;
import com.iimsoft.uras.dispatching.RuleEngine;
import com.iimsoft.uras.ga.GeneticAlgorithmScheduler.GAParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 引擎默认参数（GA / CP / 派工）。
 *
 * 配置来源（优先级从高到低）：
 * 1) JVM 参数：-Duras.config=JSON
 * 2) classpath:uras-defaults.json
 * 3) 代码内默认值
 *
 * 请求里的算法参数再逐字段覆盖这里的值（null 表示沿用）。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    /** JVM 参数 key */
    public static final String CONFIG_JSON_PROPERTY = "uras.config";
    public static final String DEFAULTS_RESOURCE = "uras-defaults.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public GAParams ga = new GAParams();
    public CpConfig cp = new CpConfig();
    public DispatchingConfig dispatching = new DispatchingConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DispatchingConfig {
        /** 规则名，第一个为主规则，其余依次做平局判定 */
        public List<String> rules = new ArrayList<>(DispatchingRules.DEFAULT_CHAIN);
        public EvaluationMode mode = EvaluationMode.SEQUENTIAL;
        /** WEIGHTED 模式下与 rules 一一对应；空表示全部 1.0 */
        public List<Double> weights = new ArrayList<>();
        /** 规则参数，例如 "ATC.k" */
        public Map<String, Double> ruleParameters = new LinkedHashMap<>();

        public RuleEngine toEngine() {
            return DispatchingRules.fromNames(rules, mode, weights, ruleParameters);
        }
    }

    public static EngineConfig load() {
        String json = System.getProperty(CONFIG_JSON_PROPERTY);
        if (json != null && !json.isBlank()) {
            try {
                return MAPPER.readValue(json, EngineConfig.class);
            } catch (IOException e) {
                LOGGER.warn("-D{} 配置无法解析，回退 {}: {}", CONFIG_JSON_PROPERTY, DEFAULTS_RESOURCE, e.getMessage());
            }
        }
        return loadDefaults();
    }

    static EngineConfig loadDefaults() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOGGER.debug("classpath 上没有 {}，使用内置默认值", DEFAULTS_RESOURCE);
                return new EngineConfig();
            }
            return MAPPER.readValue(in, EngineConfig.class);
        } catch (IOException e) {
            LOGGER.warn("{} 无法解析，使用内置默认值: {}", DEFAULTS_RESOURCE, e.getMessage());
            return new EngineConfig();
        }
    }

    /** 深拷贝，供单次请求覆盖参数 */
    public EngineConfig copy() {
        return MAPPER.convertValue(this, EngineConfig.class);
    }
}
