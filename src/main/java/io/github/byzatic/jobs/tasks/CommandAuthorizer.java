package io.github.byzatic.jobs.tasks;

import io.github.byzatic.jobs.base_exceptions.PermissionException;
import io.github.byzatic.jobs.model.CtrlCommand;
import io.github.byzatic.jobs.model.Job;

/**
 * Decides whether the owner of a control command may apply it to a job.
 */
@FunctionalInterface
public interface CommandAuthorizer {

    void authorize(CtrlCommand command, Job job) throws PermissionException;

    static CommandAuthorizer allowAll() {
        return (command, job) -> {
        };
    }

    /**
     * Only the job owner may control it; jobs without owner accept anybody.
     */
    static CommandAuthorizer ownerOnly() {
        return (command, job) -> {
            if (!job.getOwner().isEmpty() && !job.getOwner().equals(command.getOwnerId())) {
                throw new PermissionException("User '" + command.getOwnerId() + "' can't " + command.getCmd() + " job " + job.getId());
            }
        };
    }
}
