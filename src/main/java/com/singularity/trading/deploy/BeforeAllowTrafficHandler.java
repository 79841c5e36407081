package com.singularity.trading.deploy;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.singularity.trading.ledger.LedgerResult;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.utils.ClientUtils;
import software.amazon.awssdk.services.codedeploy.CodeDeployClient;
import software.amazon.awssdk.services.codedeploy.model.PutLifecycleEventHookExecutionStatusRequest;

import java.util.Map;

/**
 * Lambda function to be used as a PreTraffic hook in CodeDeploy.
 * Verifies that the new version can read and decode both ledger documents before traffic is shifted.
 */
public class BeforeAllowTrafficHandler implements RequestHandler<Map<String, Object>, Void> {

    static final String CHECK_PLAYER_ID = "deployment-check";

    private final CodeDeployClient codeDeployClient;
    private final MarketplaceLedger ledger;

    /**
     * Default constructor for BeforeAllowTrafficHandler.
     * Initializes the CodeDeploy client and the ledger from the function environment.
     */
    public BeforeAllowTrafficHandler() {
        this(null, null);
    }

    /**
     * Constructor for BeforeAllowTrafficHandler with custom dependencies.
     * Primarily used for unit testing.
     *
     * @param codeDeployClient The CodeDeploy client to use.
     * @param ledger           The marketplace ledger to check.
     */
    public BeforeAllowTrafficHandler(CodeDeployClient codeDeployClient, MarketplaceLedger ledger) {
        this.codeDeployClient = codeDeployClient != null ? codeDeployClient :
                ClientUtils.configureEndpoint(CodeDeployClient.builder())
                .overrideConfiguration(ClientUtils.getXRayConfig())
                .build();
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
    }

    /**
     * Handles the PreTraffic lifecycle event from CodeDeploy.
     * Checks the ledger and reports the status back to CodeDeploy.
     *
     * @param event   The event data from CodeDeploy.
     * @param context The Lambda execution context.
     * @return null as expected by the RequestHandler interface for this event.
     */
    @Override
    public Void handleRequest(Map<String, Object> event, Context context) {
        context.getLogger().log("BeforeAllowTraffic hook started. Event: " + event);

        String deploymentId = (String) event.get("DeploymentId");
        String lifecycleEventHookExecutionId = (String) event.get("LifecycleEventHookExecutionId");

        try {
            validateDeployment(context);

            context.getLogger().log("Validation succeeded. Reporting Succeeded to CodeDeploy.");
            reportStatus(deploymentId, lifecycleEventHookExecutionId, "Succeeded");
        } catch (Exception e) {
            context.getLogger().log("Validation failed: " + e.getMessage());
            reportStatus(deploymentId, lifecycleEventHookExecutionId, "Failed");
        }

        return null;
    }

    /**
     * Reads the listings and the trade log through the ledger.
     *
     * @param context The Lambda execution context.
     * @throws IllegalStateException if either read fails.
     */
    private void validateDeployment(Context context) {
        context.getLogger().log("Performing pre-traffic ledger checks...");
        LedgerResult<?> listings = ledger.listActiveListings();
        if (!listings.isSuccess()) {
            throw new IllegalStateException("Listings check failed: " + listings.getMessage());
        }
        LedgerResult<?> history = ledger.tradeHistory(CHECK_PLAYER_ID);
        if (!history.isSuccess()) {
            throw new IllegalStateException("Trade history check failed: " + history.getMessage());
        }
    }

    /**
     * Reports the lifecycle event hook execution status to CodeDeploy.
     *
     * @param deploymentId The ID of the deployment.
     * @param hookId       The lifecycle event hook execution ID.
     * @param status       The status to report (e.g., "Succeeded", "Failed").
     */
    private void reportStatus(String deploymentId, String hookId, String status) {
        PutLifecycleEventHookExecutionStatusRequest request = PutLifecycleEventHookExecutionStatusRequest.builder()
                .deploymentId(deploymentId)
                .lifecycleEventHookExecutionId(hookId)
                .status(status)
                .build();
        codeDeployClient.putLifecycleEventHookExecutionStatus(request);
    }
}
