package com.gnovoa.livematch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.livematch.access.MatchAuthorizer;
import com.gnovoa.livematch.access.OwnershipMatchAuthorizer;
import com.gnovoa.livematch.access.ViewerLinks;
import com.gnovoa.livematch.access.ViewerProperties;
import com.gnovoa.livematch.broadcast.BroadcastHub;
import com.gnovoa.livematch.broadcast.BroadcastProperties;
import com.gnovoa.livematch.cache.CacheProperties;
import com.gnovoa.livematch.cache.ReadCache;
import com.gnovoa.livematch.core.MatchGuard;
import com.gnovoa.livematch.core.MatchStateMachine;
import com.gnovoa.livematch.core.PeriodTracker;
import com.gnovoa.livematch.core.PostCommitEffects;
import com.gnovoa.livematch.core.ScoreProjector;
import com.gnovoa.livematch.core.TransactionRunner;
import com.gnovoa.livematch.ledger.EventLedger;
import com.gnovoa.livematch.lineup.FormationSnapshotter;
import com.gnovoa.livematch.lineup.LineupTracker;
import com.gnovoa.livematch.positions.PositionClassifier;
import com.gnovoa.livematch.positions.PositionProperties;
import com.gnovoa.livematch.positions.PositionZoneCatalog;
import com.gnovoa.livematch.positions.ZonePositionClassifier;
import com.gnovoa.livematch.query.MatchReadService;
import com.gnovoa.livematch.quota.PlanQuotaChecker;
import com.gnovoa.livematch.quota.QuotaChecker;
import com.gnovoa.livematch.quota.QuotaProperties;
import com.gnovoa.livematch.store.InMemoryMatchStore;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class EngineWiring {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryMatchStore matchStore() {
        return new InMemoryMatchStore();
    }

    @Bean
    public MatchAuthorizer matchAuthorizer() {
        return new OwnershipMatchAuthorizer();
    }

    @Bean
    public ViewerLinks viewerLinks(Clock clock, ViewerProperties props) {
        return new ViewerLinks(clock, props.linkTtl());
    }

    @Bean
    public PositionZoneCatalog positionZoneCatalog(ObjectMapper mapper, PositionProperties props) {
        return new PositionZoneCatalog(mapper, props);
    }

    @Bean
    public PositionClassifier positionClassifier(PositionZoneCatalog catalog) {
        return new ZonePositionClassifier(catalog);
    }

    @Bean
    public QuotaChecker quotaChecker(InMemoryMatchStore store, QuotaProperties props) {
        return new PlanQuotaChecker(store, props);
    }

    @Bean
    public CacheManager cacheManager(CacheProperties props, Clock clock) {
        return ReadCache.cacheManager(props, clock);
    }

    @Bean(destroyMethod = "clear")
    public ReadCache readCache(CacheManager cacheManager) {
        return new ReadCache(cacheManager);
    }

    @Bean
    public ThreadPoolTaskExecutor broadcastExecutor(BroadcastProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.workerThreads());
        executor.setMaxPoolSize(props.workerThreads());
        executor.setThreadNamePrefix("broadcast-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public BroadcastHub broadcastHub(Clock clock, ThreadPoolTaskExecutor broadcastExecutor, BroadcastProperties props) {
        return new BroadcastHub(clock, broadcastExecutor, props.queueCapacity());
    }

    @Bean
    public TransactionRunner transactionRunner(InMemoryMatchStore store) {
        return new TransactionRunner(store);
    }

    @Bean
    public MatchGuard matchGuard(MatchAuthorizer authorizer) {
        return new MatchGuard(authorizer);
    }

    @Bean
    public PeriodTracker periodTracker() {
        return new PeriodTracker();
    }

    @Bean
    public ScoreProjector scoreProjector(TransactionRunner runner, ReadCache cache) {
        return new ScoreProjector(runner, cache);
    }

    @Bean
    public PostCommitEffects postCommitEffects(ReadCache cache, BroadcastHub hub, ScoreProjector scores) {
        return new PostCommitEffects(cache, hub, scores);
    }

    @Bean
    public EventLedger eventLedger(TransactionRunner runner, MatchGuard guard, QuotaChecker quota,
                                   PostCommitEffects effects, Clock clock) {
        return new EventLedger(runner, guard, quota, effects, clock);
    }

    @Bean
    public LineupTracker lineupTracker(TransactionRunner runner, MatchGuard guard, PeriodTracker periods,
                                       EventLedger ledger) {
        return new LineupTracker(runner, guard, periods, ledger);
    }

    @Bean
    public FormationSnapshotter formationSnapshotter(TransactionRunner runner, MatchGuard guard, QuotaChecker quota,
                                                     PeriodTracker periods, EventLedger ledger,
                                                     PositionClassifier classifier, PostCommitEffects effects,
                                                     ObjectMapper mapper, Clock clock) {
        return new FormationSnapshotter(runner, guard, quota, periods, ledger, classifier, effects, mapper, clock);
    }

    @Bean
    public MatchStateMachine matchStateMachine(TransactionRunner runner, MatchGuard guard, PeriodTracker periods,
                                               PostCommitEffects effects, Clock clock) {
        return new MatchStateMachine(runner, guard, periods, effects, clock);
    }

    @Bean
    public MatchReadService matchReadService(TransactionRunner runner, MatchGuard guard, PeriodTracker periods,
                                             ReadCache cache, ViewerLinks viewerLinks, Clock clock) {
        return new MatchReadService(runner, guard, periods, cache, viewerLinks, clock);
    }
}
