package com.team.issueintel.service.issue;

import com.team.issueintel.TestFixtures;
import com.team.issueintel.config.EmbeddingApiConfig;
import com.team.issueintel.config.IssueIntelligenceConfig;
import com.team.issueintel.exception.IssuePersistenceException;
import com.team.issueintel.model.BrandImpact;
import com.team.issueintel.model.ImpactLevel;
import com.team.issueintel.model.LocationImpact;
import com.team.issueintel.model.Priority;
import com.team.issueintel.model.ProcessingAction;
import com.team.issueintel.model.ProcessingResult;
import com.team.issueintel.model.entity.BrandReference;
import com.team.issueintel.model.entity.Issue;
import com.team.issueintel.model.entity.LocationReference;
import com.team.issueintel.repository.BrandRepository;
import com.team.issueintel.repository.IssueRepository;
import com.team.issueintel.repository.LocationRepository;
import com.team.issueintel.repository.ProcessingLogRepository;
import com.team.issueintel.repository.ReportGenerationTaskRepository;
import com.team.issueintel.service.embedding.EmbeddingGateway;
import com.team.issueintel.service.embedding.EmbeddingProvider;
import com.team.issueintel.service.report.ReportOutbox;
import com.team.issueintel.service.similarity.IssueMatcher;
import com.team.issueintel.service.similarity.SimilarityAnalyzer;
import com.team.issueintel.util.TextPreprocessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.team.issueintel.TestFixtures.BRAND;
import static com.team.issueintel.TestFixtures.LOCATION;
import static com.team.issueintel.TestFixtures.LOCATION_MEMBERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

/**
 * End-to-end ticket processing with real matching and aggregation, an in-memory issue store
 * and a deterministic bag-of-words embedding provider.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Ticket processing scenarios")
class IssueOrchestratorScenarioTest {

    private static final int DIMENSIONS = 256;

    @Mock
    private IssueRepository issueRepository;

    @Mock
    private BrandRepository brandRepository;

    @Mock
    private LocationRepository locationRepository;

    @Mock
    private ReportGenerationTaskRepository taskRepository;

    @Mock
    private ProcessingLogRepository processingLogRepository;

    private final Map<String, Issue> store = new LinkedHashMap<>();
    private IssueIntelligenceConfig config;
    private IssueOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        config = new IssueIntelligenceConfig();
        EmbeddingGateway gateway = new EmbeddingGateway(new BagOfWordsEmbeddingProvider(), new EmbeddingApiConfig());
        TicketClassifier classifier = new TicketClassifier();
        orchestrator = new IssueOrchestrator(
                issueRepository,
                new IssueMatcher(new SimilarityAnalyzer(gateway)),
                new ImpactAggregator(brandRepository, locationRepository, classifier),
                classifier,
                gateway,
                new ReportOutbox(taskRepository),
                new ProcessingLogRecorder(processingLogRepository),
                config);

        given(brandRepository.findById(BRAND)).willReturn(Optional.of(
                BrandReference.builder().id(BRAND).name("Hapana").code("HAP").memberCount(5000).build()));
        given(locationRepository.findByIdAndBrandId(LOCATION, BRAND)).willReturn(Optional.of(
                LocationReference.builder().id(LOCATION).name("Downtown").brandId(BRAND)
                        .memberCount(LOCATION_MEMBERS).build()));
        given(issueRepository.findAllByOrderByUpdatedAtDesc(any())).willAnswer(inv -> store.values().stream()
                .map(TestFixtures::copyOf)
                .collect(Collectors.toCollection(ArrayList::new)));
        given(issueRepository.findById(anyString())).willAnswer(inv ->
                Optional.ofNullable(store.get(inv.getArgument(0, String.class))).map(TestFixtures::copyOf));
        given(issueRepository.save(any(Issue.class))).willAnswer(this::persist);
    }

    private Issue persist(InvocationOnMock invocation) {
        Issue issue = invocation.getArgument(0);
        store.put(issue.getId(), TestFixtures.copyOf(issue));
        return issue;
    }

    @Test
    @DisplayName("first ticket against an empty pool creates an issue with one member at gym-001")
    void firstTicket_createsIssue() {
        ProcessingResult result = orchestrator.processTicket(TestFixtures.ticket(
                "HF-1", "Mobile app login failure", "Members cannot log in to the mobile app"));

        assertThat(result.getAction()).isEqualTo(ProcessingAction.CREATED);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getSimilarIssues()).isEmpty();

        Issue issue = store.get(result.getIssueId());
        assertThat(issue.hasEmbedding()).isTrue();
        BrandImpact brandImpact = issue.findBrandImpact(BRAND).orElseThrow();
        assertThat(brandImpact.getBrandName()).isEqualTo("Hapana");
        assertThat(brandImpact.getLocationImpacts()).hasSize(1);
        LocationImpact location = brandImpact.findLocation(LOCATION).orElseThrow();
        assertThat(location.getAffectedMembers()).isEqualTo(1);
        assertThat(location.getImpactPercentage()).isCloseTo(0.222, within(0.001));
        assertThat(location.getImpactLevel()).isEqualTo(ImpactLevel.LOW);
    }

    @Test
    @DisplayName("near-identical second ticket from the same location links and counts a second member")
    void secondTicket_linksToIssue() {
        ProcessingResult first = orchestrator.processTicket(TestFixtures.ticket(
                "HF-1", "Mobile app login failure", "Members cannot log in to the mobile app"));

        ProcessingResult second = orchestrator.processTicket(TestFixtures.ticket(
                "HF-2", "Mobile app login failure", "Members cannot log in to the mobile app today"));

        assertThat(second.getAction()).isEqualTo(ProcessingAction.LINKED);
        assertThat(second.getIssueId()).isEqualTo(first.getIssueId());
        assertThat(second.getConfidence()).isGreaterThanOrEqualTo(0.8);
        assertThat(second.getSimilarIssues()).singleElement().satisfies(similar -> {
            assertThat(similar.getIssueId()).isEqualTo(first.getIssueId());
            assertThat(similar.getReasons()).contains("Same brand/location affected");
        });

        Issue issue = store.get(first.getIssueId());
        assertThat(store).hasSize(1);
        assertThat(issue.getTotalAffectedMembers()).isEqualTo(2);
        assertThat(issue.getLinkedTicketIds()).containsExactlyInAnyOrder("HF-1", "HF-2");
    }

    @Test
    @DisplayName("redelivered ticket is not counted twice")
    void redeliveredTicket_isIdempotent() {
        var ticket = TestFixtures.ticket("HF-1", "Mobile app login failure", "Members cannot log in to the mobile app");
        ProcessingResult first = orchestrator.processTicket(ticket);

        ProcessingResult again = orchestrator.processTicket(ticket);

        assertThat(again.getAction()).isEqualTo(ProcessingAction.LINKED);
        assertThat(again.getIssueId()).isEqualTo(first.getIssueId());
        assertThat(store.get(first.getIssueId()).getTotalAffectedMembers()).isEqualTo(1);
    }

    @Test
    @DisplayName("urgent outage ticket requires an incident report and triggers one at the threshold")
    void urgentOutage_triggersReport() {
        config.setAutoReportThreshold(1);

        ProcessingResult result = orchestrator.processTicket(TestFixtures.ticket(
                "HF-7", "Studio check-in outage", "Entry kiosks are offline",
                Priority.URGENT, BRAND, LOCATION));

        Issue issue = store.get(result.getIssueId());
        assertThat(issue.isRequiresIncidentReport()).isTrue();
        assertThat(issue.getPriority()).isEqualTo(Priority.URGENT);
        assertThat(result.getIncidentReportsTriggered()).containsExactly(BRAND);
    }

    @Test
    @DisplayName("urgent outage ticket below the threshold requires a report but triggers none yet")
    void urgentOutage_belowThreshold() {
        ProcessingResult result = orchestrator.processTicket(TestFixtures.ticket(
                "HF-7", "Studio check-in outage", "Entry kiosks are offline",
                Priority.URGENT, BRAND, LOCATION));

        assertThat(store.get(result.getIssueId()).isRequiresIncidentReport()).isTrue();
        assertThat(result.getIncidentReportsTriggered()).isEmpty();
    }

    @Test
    @DisplayName("a failed create leaves no issue behind and redelivery creates exactly one")
    void failedCreate_redeliveryCreatesOneIssue() {
        var ticket = TestFixtures.ticket("HF-9", "Mobile app login failure", "Members cannot log in to the mobile app");
        given(issueRepository.save(any(Issue.class)))
                .willThrow(new DataAccessResourceFailureException("write timed out"))
                .willAnswer(this::persist);

        assertThatThrownBy(() -> orchestrator.processTicket(ticket)).isInstanceOf(IssuePersistenceException.class);
        assertThat(store).isEmpty();

        ProcessingResult result = orchestrator.processTicket(ticket);

        assertThat(result.getAction()).isEqualTo(ProcessingAction.CREATED);
        assertThat(store).hasSize(1);
        Issue issue = store.get(result.getIssueId());
        assertThat(issue.getLinkedTicketIds()).containsExactly("HF-9");
        assertThat(issue.getTotalAffectedMembers()).isEqualTo(1);
        assertThat(issue.findBrandImpact(BRAND).orElseThrow().findLocation(LOCATION)).isPresent();
    }

    @Test
    @DisplayName("a failed link leaves the issue untouched and redelivery counts the member once")
    void failedLink_redeliveryCountsOnce() {
        ProcessingResult first = orchestrator.processTicket(TestFixtures.ticket(
                "HF-1", "Mobile app login failure", "Members cannot log in to the mobile app"));
        var second = TestFixtures.ticket("HF-2", "Mobile app login failure", "Members cannot log in to the mobile app today");
        given(issueRepository.save(any(Issue.class)))
                .willThrow(new DataAccessResourceFailureException("write timed out"))
                .willAnswer(this::persist);

        assertThatThrownBy(() -> orchestrator.processTicket(second)).isInstanceOf(IssuePersistenceException.class);
        Issue untouched = store.get(first.getIssueId());
        assertThat(untouched.getLinkedTicketIds()).containsExactly("HF-1");
        assertThat(untouched.getTotalAffectedMembers()).isEqualTo(1);

        ProcessingResult retried = orchestrator.processTicket(second);

        assertThat(retried.getAction()).isEqualTo(ProcessingAction.LINKED);
        assertThat(store).hasSize(1);
        Issue issue = store.get(first.getIssueId());
        assertThat(issue.getLinkedTicketIds()).containsExactlyInAnyOrder("HF-1", "HF-2");
        assertThat(issue.getTotalAffectedMembers()).isEqualTo(2);
    }

    @Test
    @DisplayName("each decision embeds the ticket once and stores that vector on a new issue")
    void createdIssue_reusesTicketEmbedding() {
        CountingEmbeddingProvider provider = new CountingEmbeddingProvider();
        EmbeddingGateway gateway = new EmbeddingGateway(provider, new EmbeddingApiConfig());
        TicketClassifier classifier = new TicketClassifier();
        IssueOrchestrator counting = new IssueOrchestrator(
                issueRepository,
                new IssueMatcher(new SimilarityAnalyzer(gateway)),
                new ImpactAggregator(brandRepository, locationRepository, classifier),
                classifier,
                gateway,
                new ReportOutbox(taskRepository),
                new ProcessingLogRecorder(processingLogRepository),
                config);
        var ticket = TestFixtures.ticket("HF-1", "Mobile app login failure", "Members cannot log in to the mobile app");

        ProcessingResult result = counting.processTicket(ticket);

        assertThat(provider.calls).isEqualTo(1);
        assertThat(store.get(result.getIssueId()).getEmbedding())
                .containsExactly(new BagOfWordsEmbeddingProvider().embed(ticket.text()).block());
    }

    /**
     * Hashes each keyword of the text into a fixed-size count vector.
     */
    private static class BagOfWordsEmbeddingProvider implements EmbeddingProvider {

        @Override
        public Mono<double[]> embed(String text) {
            double[] vector = new double[DIMENSIONS];
            for (String keyword : TextPreprocessor.keywords(text)) {
                vector[Math.floorMod(keyword.hashCode(), DIMENSIONS)] += 1;
            }
            return Mono.just(vector);
        }
    }

    private static class CountingEmbeddingProvider extends BagOfWordsEmbeddingProvider {

        private int calls;

        @Override
        public Mono<double[]> embed(String text) {
            calls++;
            return super.embed(text);
        }
    }
}
