package com.webauditai.core.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.api.IInsightProvider;
import com.webauditai.core.config.RuleTables;
import com.webauditai.core.insight.InsightPrompt;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.CompetitorComparison;
import com.webauditai.core.model.CrawlerAccess;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.GeoDetails;
import com.webauditai.core.model.LlmsTxtStatus;
import com.webauditai.core.model.PageSnapshot;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.model.SubScore;
import com.webauditai.core.robots.AiCrawlerPolicy;
import com.webauditai.core.scoring.SubScoreLedger;
import com.webauditai.core.util.TextMetrics;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static com.webauditai.core.analyzer.PageSignals.isBlank;
import static com.webauditai.core.model.Severity.CRITICAL;
import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/**
 * AI 검색(GEO) 분석기.
 * 모든 차감은 전체 점수와 하위 점수 1개(citability/structure/multiModal/authority/technical)에 동시 반영.
 * AI 질의 시뮬레이션은 감점 없는 부가 정보이고, 경쟁 페이지가 주어지면 같은 결정적 검사를 한 번 더 돌려 비교한다.
 */
public final class AiSearchAnalyzer implements IAnalyzer {

    static final int CITABLE_MIN_WORDS = 50;
    static final int CITABLE_MAX_WORDS = 200;
    static final int OPENING_CHARS = 500;

    static final List<String> DIRECT_ANSWER_PATTERNS =
            List.of(" is ", " refers to ", " defined as ", " means ", " are ");
    static final List<String> QUESTION_PREFIXES =
            List.of("what ", "how ", "why ", "when ", "where ", "which ", "who ");
    static final Pattern STATISTICS =
            Pattern.compile("\\d+%|\\d+\\.\\d+|\\$\\d+|[\\d,]+\\s*(users|customers|companies|revenue|growth)");
    static final Pattern AUTHOR_BYLINE = Pattern.compile(
            "(rel=[\"']author[\"']|class=[\"'][^\"']*author[^\"']*[\"']|itemprop=[\"']author[\"'])",
            Pattern.CASE_INSENSITIVE);
    static final Set<String> PERSON_TYPES = Set.of("Person", "ProfilePage");
    static final int JS_DEPENDENT_SCRIPTS = 10;

    private final double weight;
    private final RuleTables rules;
    private final IInsightProvider insight;

    public AiSearchAnalyzer(IInsightProvider insight) {
        this(Category.GEO.defaultWeight(), RuleTables.defaults(), insight);
    }

    public AiSearchAnalyzer(double weight, RuleTables rules, IInsightProvider insight) {
        this.weight = weight;
        this.rules = Objects.requireNonNull(rules, "rules");
        this.insight = Objects.requireNonNull(insight, "insight");
    }

    @Override public Category category() { return Category.GEO; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        return analyze(page, fetch, null);
    }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch, PageSnapshot competitor) {
        GeoChecks ours = runChecks(page, fetch);

        // 시뮬레이션은 우리 페이지에만
        JsonNode simulation = insight.infer(InsightPrompt.AI_QUERY_SIMULATION,
                page.getBodyText(), fetch.getFinalUrl(), page.getTitle()).orElse(null);

        CompetitorComparison comparison = null;
        if (competitor != null && competitor.page() != null && competitor.fetch() != null) {
            comparison = compare(ours, runChecks(competitor.page(), competitor.fetch()), competitor.fetch());
        }

        Map<String, CrawlerAccess> status = ours.crawlerStatus();
        long allowed = status.values().stream().filter(a -> a == CrawlerAccess.ALLOWED).count();
        int score = ours.ledger().finalScore();

        GeoDetails details = new GeoDetails(
                GeoDetails.keyed(ours.ledger().subScores()),
                status,
                ours.llmsTxtStatus(),
                ours.citablePassages(),
                simulation);

        return CategoryResult.builder(Category.GEO)
                .score(score)
                .weight(weight)
                .issues(ours.ledger().issues())
                .summary("AI Search (GEO) score: " + score + "/100. " + ours.citablePassages()
                        + " citable passages. " + allowed + "/" + status.size() + " AI crawlers allowed.")
                .geoDetails(details)
                .competitorComparison(comparison)
                .build();
    }

    /** 결정적 검사 결과(같은 입력 → 같은 결과) */
    record GeoChecks(SubScoreLedger ledger,
                     int citablePassages,
                     Map<String, CrawlerAccess> crawlerStatus,
                     LlmsTxtStatus llmsTxtStatus) {}

    GeoChecks runChecks(ParsedPage page, FetchResult fetch) {
        SubScoreLedger l = new SubScoreLedger(Category.GEO);
        int words = page.getWordCount();
        String body = page.getBodyText();
        List<String> paragraphs = page.getParagraphs();

        // ---- citability ----
        int citable = countCitable(paragraphs);
        if (citable == 0 && words > 200) {
            l.record(SubScore.CITABILITY, "geo-no-citable-passages", HIGH,
                    "No citable passages",
                    "Zero paragraphs in the 50-200 word sweet spot for AI citations.",
                    "Structure content with 50-200 word paragraphs (optimal: 134-167 words).",
                    "AI systems cannot extract clean citations", 12);
        } else if (citable < 3 && words > 500) {
            l.record(SubScore.CITABILITY, "geo-few-citable-passages", MEDIUM,
                    "Few citable passages",
                    "Only " + citable + " passage(s) in the AI-citation sweet spot.",
                    "Break content into more 50-200 word paragraphs.",
                    "Limited citation opportunities", 6);
        }

        if (!hasDirectAnswer(body) && words > 200) {
            l.record(SubScore.CITABILITY, "geo-no-direct-answer", MEDIUM,
                    "No direct answer pattern",
                    "Opening content doesn't include direct definitions (e.g., 'X is...').",
                    "Start with a clear definition. AI search prefers direct answers early.",
                    "Lower citation priority", 5);
        }

        if (!STATISTICS.matcher(body).find() && words > 200) {
            l.record(SubScore.CITABILITY, "geo-no-statistics", LOW,
                    "No data points or statistics",
                    "No quantitative data found in body content.",
                    "Add specific numbers, percentages, or data points to strengthen citations.",
                    "Weaker citation authority", 4);
        }

        // ---- structure ----
        if (!hasQuestionHeading(page.allHeadings()) && words > 500) {
            l.record(SubScore.STRUCTURE, "geo-no-question-headings", MEDIUM,
                    "No question-based headings",
                    "No headings match AI query patterns (What, How, Why...).",
                    "Add question-based H2/H3 headings that match how users ask AI.",
                    "Lower AI Overviews citation chance", 6);
        }

        boolean broken = (page.hasHeadings(3) && !page.hasHeadings(2))
                || (page.hasHeadings(4) && !page.hasHeadings(3));
        if (broken) {
            l.record(SubScore.STRUCTURE, "geo-broken-hierarchy", MEDIUM,
                    "Broken heading hierarchy",
                    "Heading levels are skipped (e.g., H3 without H2).",
                    "Maintain proper H1 → H2 → H3 hierarchy for AI parsing.",
                    "AI may misinterpret content structure", 5);
        }

        if (page.getUnorderedLists() + page.getOrderedLists() == 0 && words > 300) {
            l.record(SubScore.STRUCTURE, "geo-no-lists", LOW,
                    "No list elements",
                    "No unordered or ordered lists found.",
                    "Use bullet/numbered lists. AI search frequently cites list content.",
                    "Missed featured snippet opportunity", 4);
        }

        double avgParagraph = averageParagraphWords(paragraphs);
        if (avgParagraph > 100 && words > 300) {
            l.record(SubScore.STRUCTURE, "geo-wall-of-text", MEDIUM,
                    "Wall of text detected",
                    "Average paragraph length: " + String.format(Locale.ROOT, "%.0f", avgParagraph) + " words.",
                    "Break into shorter paragraphs (50-100 words max).",
                    "AI struggles to extract specific claims", 5);
        }

        // ---- multiModal ----
        int images = page.getImages().size();
        if (images == 0 && words > 300) {
            l.record(SubScore.MULTI_MODAL, "geo-no-images", MEDIUM,
                    "No images",
                    "Page has no images despite substantial text content.",
                    "Add relevant images. Multi-modal pages rank higher in AI results.",
                    "Lower engagement and AI ranking signals", 8);
        }
        if (page.getVideos().isEmpty()) {
            l.record(SubScore.MULTI_MODAL, "geo-no-video", LOW,
                    "No video content",
                    "No video or video embeds detected.",
                    "Consider adding video. AI platforms increasingly surface video content.",
                    "Missing multi-modal signal", 4);
        }
        int noAlt = PageSignals.missingAlt(page.getImages());
        if (images > 0 && noAlt * 2 > images) {
            l.record(SubScore.MULTI_MODAL, "geo-images-no-alt", LOW,
                    "Most images lack alt text",
                    noAlt + "/" + images + " images have no alt text.",
                    "Add descriptive alt text to all images for AI understanding.",
                    "AI cannot understand image content", 3);
        }

        // ---- authority ----
        List<JsonNode> blocks = page.getStructuredData();
        boolean person = PageSignals.hasType(blocks, PERSON_TYPES);
        boolean byline = AUTHOR_BYLINE.matcher(fetch.getHtml()).find();
        if (!person && !byline && words > 300) {
            l.record(SubScore.AUTHORITY, "geo-no-author", MEDIUM,
                    "No author attribution",
                    "No Person schema or author byline found.",
                    "Add author information with Person schema. AI values attributed content.",
                    "Weaker E-E-A-T signal for AI", 6);
        }
        if (!PageSignals.hasDateSignal(blocks) && words > 300) {
            l.record(SubScore.AUTHORITY, "geo-no-dates", MEDIUM,
                    "No publication dates",
                    "No datePublished or dateModified in schema.",
                    "Add date metadata. AI search prioritizes fresh, dated content.",
                    "AI cannot determine content freshness", 5);
        }
        if (!PageSignals.hasType(blocks, Set.of("Organization"))) {
            l.record(SubScore.AUTHORITY, "geo-no-org-schema", LOW,
                    "No Organization schema",
                    "No Organization structured data found.",
                    "Add Organization JSON-LD to establish brand authority.",
                    "Weaker brand signal for AI", 4);
        }
        int external = page.getExternalLinks().size();
        if (external < 2 && words > 300) {
            l.record(SubScore.AUTHORITY, "geo-no-source-citations", LOW,
                    "Few source citations",
                    "Only " + external + " external link(s). AI values well-sourced content.",
                    "Add citations to authoritative sources.",
                    "Lower perceived trustworthiness", 3);
        }
        if (!hasSameAs(blocks)) {
            l.record(SubScore.AUTHORITY, "geo-no-same-as", LOW,
                    "No sameAs in schema",
                    "No sameAs property linking to social profiles.",
                    "Add sameAs URLs to Organization/Person schema.",
                    "Weaker entity recognition", 2);
        }

        // ---- technical AI access ----
        AiCrawlerPolicy policy = AiCrawlerPolicy.of(fetch.getRobotsTxt());
        if (policy.wildcardBlock()) {
            l.record(SubScore.TECHNICAL, "geo-wildcard-block", CRITICAL,
                    "All bots blocked via wildcard",
                    "robots.txt blocks all crawlers with 'Disallow: /'. Site is invisible to AI search.",
                    "Remove the wildcard block or allow specific AI crawlers.",
                    "Completely invisible to AI search", 10);
        } else {
            List<String> keyBlocked = policy.agentBlocked(rules.keyAiCrawlers());
            if (!keyBlocked.isEmpty()) {
                l.record(SubScore.TECHNICAL, "geo-crawlers-blocked", HIGH,
                        "AI crawlers blocked",
                        "Blocked in robots.txt: " + String.join(", ", keyBlocked) + ".",
                        "Allow GPTBot, ClaudeBot, PerplexityBot to crawl your site.",
                        "Invisible to major AI search engines", 8);
            }
        }

        if (isBlank(fetch.getLlmsTxt())) {
            l.record(SubScore.TECHNICAL, "geo-no-llms-txt", MEDIUM,
                    "No llms.txt file",
                    "No /llms.txt found. This standard helps AI systems understand your site.",
                    "Create a /llms.txt file describing your site for AI systems.",
                    "Missed AI discoverability signal", 5);
        }

        int blocking = PageSignals.renderBlockingScripts(page);
        if (blocking > JS_DEPENDENT_SCRIPTS) {
            l.record(SubScore.TECHNICAL, "geo-js-dependent", MEDIUM,
                    "Heavy JavaScript dependency",
                    blocking + " render-blocking scripts. AI crawlers may not execute JS.",
                    "Add async/defer to scripts. Ensure content is in initial HTML.",
                    "AI crawlers may see empty page", 5);
        }

        return new GeoChecks(l, citable, policy.statusOf(rules.aiCrawlers()), LlmsTxtStatus.of(fetch.getLlmsTxt()));
    }

    private static CompetitorComparison compare(GeoChecks ours, GeoChecks theirs, FetchResult theirFetch) {
        Map<SubScore, Integer> mine = ours.ledger().subScores();
        Map<SubScore, Integer> other = theirs.ledger().subScores();
        CompetitorComparison.Diff diff = CompetitorComparison.diff(mine, other);
        return new CompetitorComparison(
                theirFetch.getFinalUrl(),
                ours.ledger().finalScore(),
                theirs.ledger().finalScore(),
                GeoDetails.keyed(mine),
                GeoDetails.keyed(other),
                diff.advantages(),
                diff.gaps(),
                theirs.ledger().issues().size());
    }

    static int countCitable(List<String> paragraphs) {
        int n = 0;
        for (String p : paragraphs) {
            int w = TextMetrics.whitespaceWords(p);
            if (w >= CITABLE_MIN_WORDS && w <= CITABLE_MAX_WORDS) n++;
        }
        return n;
    }

    static double averageParagraphWords(List<String> paragraphs) {
        if (paragraphs.isEmpty()) return 0.0;
        long sum = 0;
        for (String p : paragraphs) sum += TextMetrics.whitespaceWords(p);
        return (double) sum / paragraphs.size();
    }

    static boolean hasDirectAnswer(String body) {
        if (body == null || body.isEmpty()) return false;
        String opening = body.substring(0, Math.min(OPENING_CHARS, body.length())).toLowerCase(Locale.ROOT);
        for (String p : DIRECT_ANSWER_PATTERNS) if (opening.contains(p)) return true;
        return false;
    }

    static boolean hasQuestionHeading(List<String> headings) {
        for (String h : headings) {
            if (h.endsWith("?")) return true;
            String lc = h.toLowerCase(Locale.ROOT);
            for (String q : QUESTION_PREFIXES) if (lc.startsWith(q)) return true;
        }
        return false;
    }

    private static boolean hasSameAs(List<JsonNode> blocks) {
        for (JsonNode b : blocks) {
            if (b != null && b.isObject() && PageSignals.truthy(b.get("sameAs"))) return true;
        }
        return false;
    }
}
