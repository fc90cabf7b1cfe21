package com.yerin.bgjob.application;

public interface JobExecutor {
    String execute(String handlerName, JobExecution execution) throws Exception;
}
