package org.iceforge.placefinder.provisioner.cfn;

/** Delivers the outcome of a custom resource request back to CloudFormation. */
public interface CustomResourceResponder {

    void send(String responseUrl, CustomResourceResponse response);
}
