package com.example.mailagent.workflow;

import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.repository.WorkflowInstanceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Read-modify-write of a single instance under a pessimistic row lock.
 */
@Component
public class InstanceTransactions {

    private final TransactionTemplate transactionTemplate;
    private final WorkflowInstanceRepository instanceRepository;

    public InstanceTransactions(PlatformTransactionManager transactionManager,
                                WorkflowInstanceRepository instanceRepository) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.instanceRepository = instanceRepository;
    }

    public <T> T update(String instanceId, Function<WorkflowInstance, T> mutation) {
        return transactionTemplate.execute(status -> {
            WorkflowInstance instance = instanceRepository.findForUpdate(instanceId)
                    .orElseThrow(() -> new WorkflowNotFoundException(instanceId));
            T result = mutation.apply(instance);
            instanceRepository.save(instance);
            return result;
        });
    }

    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
