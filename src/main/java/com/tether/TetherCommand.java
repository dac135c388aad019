package com.tether;

import com.tether.cleanup.TransactionalResourceCleaner;
import com.tether.crash.CrashRecoveryCoordinator;
import com.tether.events.ApplicationEventHandlers;
import com.tether.events.SubscriptionRegistry;
import com.tether.host.HostApplication;
import com.tether.host.UnhandledExceptionEvent;
import com.tether.lifecycle.CoreBootstrap;
import com.tether.lifecycle.CoreEnvironment;
import com.tether.lifecycle.InitializationException;
import com.tether.lifecycle.InitializationGate;
import com.tether.model.CoreModel;
import com.tether.model.CoreStartConfiguration;
import com.tether.model.SessionComponentFactory;
import com.tether.model.ViewModel;
import com.tether.model.WorkspaceView;
import com.tether.scheduler.IdleTaskScheduler;
import com.tether.session.Session;
import com.tether.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Tether's entry point, invoked by the host's command button.
 *
 * One instance lives for the whole host process. Each invocation initializes
 * the core once, attaches a session, shows the workspace and subscribes to
 * host events. This method and the crash coordinator are the only places that
 * catch broadly; nothing escapes into the host.
 */
public class TetherCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(TetherCommand.class);

    private final TetherEnvironment environment;
    private final IdleTaskScheduler scheduler = new IdleTaskScheduler();
    private final InitializationGate initializationGate;

    private HostApplication application;
    private SubscriptionRegistry subscriptions;
    private SessionManager sessions;
    private ApplicationEventHandlers eventHandlers;
    private TransactionalResourceCleaner cleaner;
    private CrashRecoveryCoordinator crashCoordinator;
    private SessionTeardown teardown;

    public TetherCommand(TetherEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.initializationGate = new InitializationGate(new CoreBootstrap(
            environment.moduleLocation(),
            environment.configService(),
            environment.pathResolver(),
            environment.libraryLoader(),
            scheduler));
    }

    /**
     * Runs the entry point.
     *
     * @param context the host application and journal data
     * @return SUCCEEDED once the workspace is shown, FAILED with a message on
     *         any startup error, CANCELLED if a session is already live
     */
    public CommandOutcome execute(CommandContext context) {
        Objects.requireNonNull(context, "context");

        CoreEnvironment core;
        try {
            handleDebug(context);
            bindTo(context.application());

            if (sessions.isAttached()) {
                LOGGER.warn("Entry point invoked while {} is live", sessions.current().get());
                return CommandOutcome.cancelled("Tether is already running");
            }

            core = initializationGate.initializeOnce(context);

            if (crashCoordinator == null) {
                crashCoordinator = new CrashRecoveryCoordinator(sessions, environment.telemetry(),
                    environment.entryPointControl(), core.config().crashPromptIncludesStackTrace());
                sessions.addAttachListener(crashCoordinator::onSessionAttached);
            }
        } catch (InitializationException e) {
            LOGGER.error("Tether could not initialize", e);
            return fail(e, e.getMessage(), false);
        } catch (RuntimeException e) {
            LOGGER.error("Tether could not initialize", e);
            return fail(e, e.toString(), true);
        }

        try {
            Session session = startSession(context, core);
            openWorkspaceFromJournal(context, core, session.coreModel());
            subscriptions.subscribe(eventHandlers);

            // Prevent a re-run while the workspace is open
            environment.entryPointControl().setEnabled(false);
            LOGGER.info("Tether started {}", session);

        } catch (Exception e) {
            LOGGER.error("Tether failed to start", e);
            abandonSession();
            return fail(e, e.toString(), true);
        }

        return CommandOutcome.succeeded();
    }

    private CommandOutcome fail(Exception e, String message, boolean crashed) {
        bestEffort("telemetry", () -> {
            environment.telemetry().logException(e);
            if (crashed) {
                environment.telemetry().notifyCrash();
            }
        });
        bestEffort("message", () -> environment.messagePresenter().showBlocking(message));
        bestEffort("re-enable", () -> environment.entryPointControl().setEnabled(true));
        return CommandOutcome.failed(message);
    }

    private Session startSession(CommandContext context, CoreEnvironment core) {
        SessionComponentFactory factory = environment.componentFactory();
        HostApplication host = context.application();

        CoreModel coreModel = factory.startCore(new CoreStartConfiguration(
            core.paths().coreDirectory(),
            core.geometryFactoryPath(),
            HostContextName.fromVersionName(host.versionName())), host);
        Session session = sessions.attach(coreModel);

        ViewModel viewModel = factory.startViewModel(coreModel);
        session.attachViewModel(viewModel);
        coreModel.addShutdownListener(() -> cleaner.scheduleMarkerDeletion(session));

        coreModel.handlePostInitialization();

        WorkspaceView view = factory.createView(viewModel);
        session.attachView(view);

        teardown = new SessionTeardown(session, view);
        view.dispatcher().addUnhandledExceptionHandler(teardown.crashHandler);
        view.addClosedListener(teardown);

        view.show();
        return session;
    }

    private void openWorkspaceFromJournal(CommandContext context, CoreEnvironment core, CoreModel coreModel) {
        Optional<String> workspace = context.journalValue(core.config().workspaceJournalKey());
        if (workspace.isEmpty()) {
            return;
        }

        Path path;
        try {
            path = Path.of(workspace.get());
        } catch (InvalidPathException e) {
            LOGGER.warn("Ignoring unusable workspace path '{}' from journal", workspace.get(), e);
            return;
        }
        LOGGER.info("Opening workspace {} from journal", path);
        coreModel.openFile(path);
    }

    private void handleDebug(CommandContext context) {
        Optional<String> debug = context.journalValue(CommandContext.DEBUG_KEY);
        if (debug.isEmpty()) {
            return;
        }
        if (Boolean.parseBoolean(debug.get().trim())) {
            LOGGER.info("Journal requested debugging, waiting for debugger");
            environment.debuggerLauncher().launch();
        } else if (!debug.get().trim().equalsIgnoreCase("false")) {
            LOGGER.warn("Journal value '{}' for '{}' is not a boolean, ignoring", debug.get(), CommandContext.DEBUG_KEY);
        }
    }

    private void bindTo(HostApplication host) {
        if (application != null) {
            if (application != host) {
                LOGGER.warn("Entry point invoked with a different host application, keeping the first one");
            }
            return;
        }
        application = host;
        subscriptions = new SubscriptionRegistry(host);
        sessions = new SessionManager(initializationGate, subscriptions);
        eventHandlers = ApplicationEventHandlers.forwardingTo(sessions);
        cleaner = new TransactionalResourceCleaner(scheduler, host);
    }

    /**
     * Drops a session whose startup failed. Its window, if already shown, is
     * unhooked first so closing it later cannot touch the next session.
     */
    private void abandonSession() {
        Optional<Session> detached = sessions.detach();
        if (detached.isEmpty()) {
            return;
        }
        Session session = detached.get();

        if (teardown != null && teardown.session == session) {
            teardown.release();
            teardown = null;
        }
        if (session.view() != null) {
            bestEffort("close view", () -> session.viewModel().exit(false));
        }
        bestEffort("dispose", () -> session.coreModel().dispose());
    }

    private static void bestEffort(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Step '{}' failed", step, e);
        }
    }

    public IdleTaskScheduler getScheduler() {
        return scheduler;
    }

    public InitializationGate getInitializationGate() {
        return initializationGate;
    }

    /**
     * Empty until the first invocation binds the command to a host.
     */
    public Optional<SessionManager> getSessions() {
        return Optional.ofNullable(sessions);
    }

    public Optional<SubscriptionRegistry> getSubscriptions() {
        return Optional.ofNullable(subscriptions);
    }

    public Optional<CrashRecoveryCoordinator> getCrashCoordinator() {
        return Optional.ofNullable(crashCoordinator);
    }

    public Optional<TransactionalResourceCleaner> getCleaner() {
        return Optional.ofNullable(cleaner);
    }

    /**
     * Runs when the workspace window closes: detaches the crash handler and the
     * host events, disposes the core model, drops the session and re-enables the
     * entry point. Tasks already queued on the scheduler still run.
     *
     * Only acts while its session is the live one; a window left over from an
     * earlier session just unhooks itself.
     */
    private final class SessionTeardown implements Runnable {

        private final Session session;
        private final WorkspaceView view;
        private final Consumer<UnhandledExceptionEvent> crashHandler;

        SessionTeardown(Session session, WorkspaceView view) {
            this.session = session;
            this.view = view;
            this.crashHandler = this::onUnhandledException;
        }

        private boolean isLive() {
            return sessions.current().orElse(null) == session;
        }

        private void onUnhandledException(UnhandledExceptionEvent event) {
            if (isLive()) {
                crashCoordinator.onUnhandledException(event);
                return;
            }
            event.setHandled(true);
            LOGGER.warn("Unhandled exception from the window of ended {}", session, event.getException());
        }

        void release() {
            view.dispatcher().removeUnhandledExceptionHandler(crashHandler);
            view.removeClosedListener(this);
        }

        @Override
        public void run() {
            release();
            if (teardown == this) {
                teardown = null;
            }

            if (!isLive()) {
                LOGGER.debug("Window of ended {} closed, nothing to tear down", session);
                return;
            }
            LOGGER.info("Workspace closed, tearing down {}", session);

            subscriptions.unsubscribe(eventHandlers);
            bestEffort("dispose", () -> session.coreModel().dispose());
            sessions.detach();
            environment.entryPointControl().setEnabled(true);
        }
    }
}
