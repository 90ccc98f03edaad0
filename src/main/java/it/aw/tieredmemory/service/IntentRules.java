package it.aw.tieredmemory.service;

import it.aw.tieredmemory.model.QueryIntent;

import java.util.List;
import java.util.Locale;

/**
 * Tabella ordinata intento → keyword usata dal {@link QueryClassifier}.
 * <p>
 * L'ordine delle regole è anche il criterio di spareggio: a parità di punteggio
 * vince l'intento dichiarato per primo. Il vocabolario copre cinese e inglese.
 */
public record IntentRules(List<IntentRule> rules) {

    /** Una riga della tabella. Le keyword sono normalizzate in minuscolo. */
    public record IntentRule(QueryIntent intent, List<String> keywords) {
        public IntentRule {
            keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        }
    }

    public IntentRules {
        rules = List.copyOf(rules);
    }

    public static IntentRules defaults() {
        return new IntentRules(List.of(
                new IntentRule(QueryIntent.FACTUAL_DATE, List.of(
                        "什么时候", "日期", "时间", "几号",
                        "when", "what day", "which day", "deadline")),
                new IntentRule(QueryIntent.ADMINISTRATIVE, List.of(
                        "检查", "状态", "报告", "总结", "进度", "概览", "汇总",
                        "status", "progress", "report", "overview", "check")),
                new IntentRule(QueryIntent.ANALYTICAL, List.of(
                        "分析", "为什么", "原因", "对比", "优劣", "优缺点", "评估",
                        "why", "analyze", "analyse", "analysis", "compare", "evaluate")),
                new IntentRule(QueryIntent.CREATIVE, List.of(
                        "如何", "改进", "创意", "建议", "想法", "怎么办", "设计", "优化",
                        "how to", "how can", "improve", "idea", "suggest", "design")),
                new IntentRule(QueryIntent.FACTUAL_LIST, List.of(
                        "列出", "有哪些", "什么技能",
                        "list", "enumerate", "which skills")),
                new IntentRule(QueryIntent.FACTUAL, List.of(
                        "哪里", "谁", "是什么", "多少",
                        "what is", "who", "where", "how many"))
        ));
    }
}
