package com.singularity.trading.deploy;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.singularity.trading.ledger.LedgerResult;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.model.Listing;
import com.singularity.trading.utils.ClientUtils;
import software.amazon.awssdk.services.codedeploy.CodeDeployClient;
import software.amazon.awssdk.services.codedeploy.model.PutLifecycleEventHookExecutionStatusRequest;

import java.util.List;
import java.util.Map;

/**
 * Lambda function to be used as a PostTraffic hook in CodeDeploy.
 * Confirms the marketplace still serves listings after traffic has been shifted to the new version.
 */
public class AfterAllowTrafficHandler implements RequestHandler<Map<String, Object>, Void> {

    private final CodeDeployClient codeDeployClient;
    private final MarketplaceLedger ledger;

    /**
     * Default constructor for AfterAllowTrafficHandler.
     * Initializes the CodeDeploy client and the ledger from the function environment.
     */
    public AfterAllowTrafficHandler() {
        this(null, null);
    }

    /**
     * Constructor for AfterAllowTrafficHandler with custom dependencies.
     * Primarily used for unit testing.
     *
     * @param codeDeployClient The CodeDeploy client to use.
     * @param ledger           The marketplace ledger to check.
     */
    public AfterAllowTrafficHandler(CodeDeployClient codeDeployClient, MarketplaceLedger ledger) {
        this.codeDeployClient = codeDeployClient != null ? codeDeployClient :
                ClientUtils.configureEndpoint(CodeDeployClient.builder())
                .overrideConfiguration(ClientUtils.getXRayConfig())
                .build();
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
    }

    /**
     * Handles the PostTraffic lifecycle event from CodeDeploy.
     *
     * @param event   The event data from CodeDeploy.
     * @param context The Lambda execution context.
     * @return null as expected by the RequestHandler interface for this event.
     */
    @Override
    public Void handleRequest(Map<String, Object> event, Context context) {
        context.getLogger().log("AfterAllowTraffic hook started. Event: " + event);

        String deploymentId = (String) event.get("DeploymentId");
        String lifecycleEventHookExecutionId = (String) event.get("LifecycleEventHookExecutionId");

        try {
            LedgerResult<List<Listing>> listings = ledger.listActiveListings();
            if (!listings.isSuccess()) {
                throw new IllegalStateException("Listings check failed: " + listings.getMessage());
            }
            context.getLogger().log("Post-traffic validation succeeded with " + listings.getValue().size()
                    + " active listings. Reporting Succeeded to CodeDeploy.");
            reportStatus(deploymentId, lifecycleEventHookExecutionId, "Succeeded");
        } catch (Exception e) {
            context.getLogger().log("Post-traffic validation failed: " + e.getMessage());
            reportStatus(deploymentId, lifecycleEventHookExecutionId, "Failed");
        }

        return null;
    }

    private void reportStatus(String deploymentId, String hookId, String status) {
        codeDeployClient.putLifecycleEventHookExecutionStatus(PutLifecycleEventHookExecutionStatusRequest.builder()
                .deploymentId(deploymentId)
                .lifecycleEventHookExecutionId(hookId)
                .status(status)
                .build());
    }
}
