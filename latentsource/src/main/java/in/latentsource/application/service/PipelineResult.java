package in.latentsource.application.service;

import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.model.ScaleLibraries;
import in.latentsource.domain.model.Signal;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;

/**
 * Everything one pipeline run produces, handed to reporting collaborators.
 */
public record PipelineResult(
    ScaleLibraries libraries,
    BlendModel blendModel,
    Signal signal,
    BoundedRunResult boundedRun,
    InventoryRunResult inventoryRun
) {
}
