package com.yerin.bgjob.application;

import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
public class JobHandlerRegistry implements JobExecutor {
    private final Map<String, JobHandler> map;

    @Autowired
    public JobHandlerRegistry(ObjectProvider<JobHandler> handlers) {
        this(handlers.orderedStream().toList());
    }

    public JobHandlerRegistry(List<JobHandler> handlers) {
        this.map = handlers.stream().collect(Collectors.toMap(JobHandler::name, Function.identity()));
        log.info("[HandlerRegistry] registered handlers={}", map.keySet());
    }

    public Optional<JobHandler> find(String name) {
        return Optional.ofNullable(map.get(name));
    }

    @Override
    public String execute(String handlerName, JobExecution execution) throws Exception {
        JobHandler handler = find(handlerName)
                .orElseThrow(() -> new AppException(JobErrorCode.HANDLER_NOT_FOUND.withDetail("No handler for name=" + handlerName)));
        return handler.handle(execution);
    }
}
